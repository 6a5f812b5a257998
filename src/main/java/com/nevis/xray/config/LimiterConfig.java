package com.nevis.xray.config;

import com.nevis.xray.infra.InMemoryRpmRateLimiter;
import com.nevis.xray.infra.RateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LimiterConfig {

    @Bean("providerLimiter")
    public RateLimiter providerLimiter(ProviderProperties properties) {
        return new InMemoryRpmRateLimiter(properties.rpmLimit());
    }
}
