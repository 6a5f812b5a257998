package com.nevis.xray.config;

import com.nevis.xray.infra.NetworkProbe;
import com.nevis.xray.infra.SocketNetworkProbe;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;

@Configuration
public class ProviderHttpConfig {

    @Bean
    public RestClient providerRestClient(RestClient.Builder builder, ProviderProperties properties) {
        HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(properties.connectTimeout())
            .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(properties.readTimeout());

        return builder
            .requestFactory(requestFactory)
            .build();
    }

    @Bean
    public NetworkProbe networkProbe(ProviderProperties properties) {
        ProviderProperties.Connectivity connectivity = properties.connectivity();
        return new SocketNetworkProbe(connectivity.host(), connectivity.port(), connectivity.timeout());
    }
}
