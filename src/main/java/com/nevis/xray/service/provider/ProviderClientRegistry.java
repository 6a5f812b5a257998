package com.nevis.xray.service.provider;

import com.nevis.xray.model.ProviderType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class ProviderClientRegistry {

    private final Map<ProviderType, ProviderClient> clients = new EnumMap<>(ProviderType.class);

    public ProviderClientRegistry(List<ProviderClient> clients) {
        for (ProviderClient client : clients) {
            this.clients.put(client.type(), client);
        }
    }

    public ProviderClient get(ProviderType type) {
        ProviderClient client = clients.get(type);
        if (client == null) {
            throw new IllegalArgumentException("No client registered for provider " + type.key());
        }
        return client;
    }
}
