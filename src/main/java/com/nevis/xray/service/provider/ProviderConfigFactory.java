package com.nevis.xray.service.provider;

import com.nevis.xray.config.ProviderProperties;
import com.nevis.xray.model.ProviderConfig;
import com.nevis.xray.model.ProviderType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Builds the {@link ProviderConfig} for one request from {@code app.providers.*},
 * letting the request override the provider and model.
 */
@Component
@RequiredArgsConstructor
public class ProviderConfigFactory {

    private final ProviderProperties properties;

    public ProviderType defaultType() {
        return ProviderType.fromKey(properties.defaultProvider());
    }

    public ProviderConfig create(String provider, String modelOverride) {
        ProviderType type = provider == null || provider.isBlank() ? defaultType() : ProviderType.fromKey(provider);
        return create(type, modelOverride);
    }

    public ProviderConfig create(ProviderType type, String modelOverride) {
        ProviderProperties.Endpoint endpoint = endpointFor(type);
        String model = modelOverride == null || modelOverride.isBlank() ? endpoint.model() : modelOverride.trim();
        String apiKey = endpoint.apiKey() == null ? null : endpoint.apiKey().replaceAll("\\s+", "");
        return new ProviderConfig(type, apiKey, model, endpoint.endpoint());
    }

    private ProviderProperties.Endpoint endpointFor(ProviderType type) {
        return switch (type) {
            case GEMINI -> properties.gemini();
            case CHATGPT -> properties.chatgpt();
            case LOCAL -> properties.local();
        };
    }
}
