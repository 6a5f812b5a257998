package com.nevis.xray.config;

import com.nevis.xray.infra.LocalDirectoryRemoteSyncClient;
import com.nevis.xray.infra.RemoteSyncClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SyncConfig {

    @Bean
    public RemoteSyncClient remoteSyncClient(SyncProperties properties) {
        return new LocalDirectoryRemoteSyncClient(properties.remoteRoot());
    }
}
