package com.nevis.xray.service.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.xray.config.ProviderProperties;
import com.nevis.xray.infra.NetworkProbe;
import com.nevis.xray.infra.RateLimiter;
import com.nevis.xray.model.ProviderType;
import com.nevis.xray.service.PromptCatalog;
import com.nevis.xray.service.ResponseParser;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * Self-hosted OpenAI-compatible server (Ollama, LM Studio and the like). Runs without
 * an API key.
 */
@Component
public class LocalAiProviderClient extends OpenAiCompatibleProviderClient {

    public LocalAiProviderClient(RestClient providerRestClient,
                                 ResponseParser responseParser,
                                 ObjectMapper objectMapper,
                                 NetworkProbe networkProbe,
                                 @Qualifier("providerLimiter") RateLimiter providerLimiter,
                                 PromptCatalog prompts,
                                 ProviderProperties properties) {
        super(providerRestClient, responseParser, objectMapper, networkProbe, providerLimiter, prompts, properties);
    }

    @Override
    public ProviderType type() {
        return ProviderType.LOCAL;
    }

    @Override
    protected boolean requiresApiKey() {
        return false;
    }
}
