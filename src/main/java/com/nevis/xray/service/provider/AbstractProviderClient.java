package com.nevis.xray.service.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.xray.exception.ProviderException;
import com.nevis.xray.exception.RetryableProviderException;
import com.nevis.xray.infra.NetworkProbe;
import com.nevis.xray.infra.RateLimiter;
import com.nevis.xray.model.ConnectionTestResult;
import com.nevis.xray.model.ErrorKind;
import com.nevis.xray.model.ExtractionPayload;
import com.nevis.xray.model.ProviderConfig;
import com.nevis.xray.service.ResponseParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Locale;

/**
 * Pre-flight checks shared by every provider: credential, connectivity, rate limit.
 */
@Slf4j
public abstract class AbstractProviderClient implements ProviderClient {

    static final String TEST_PROMPT = "Test: 'OK'";

    protected final RestClient restClient;
    protected final ResponseParser responseParser;
    protected final ObjectMapper objectMapper;
    private final NetworkProbe networkProbe;
    private final RateLimiter rateLimiter;

    protected AbstractProviderClient(RestClient restClient,
                                     ResponseParser responseParser,
                                     ObjectMapper objectMapper,
                                     NetworkProbe networkProbe,
                                     RateLimiter rateLimiter) {
        this.restClient = restClient;
        this.responseParser = responseParser;
        this.objectMapper = objectMapper;
        this.networkProbe = networkProbe;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public ExtractionPayload analyze(String prompt, ProviderConfig config) {
        if (requiresApiKey() && !config.hasApiKey()) {
            throw ProviderException.noApiKey(type().label());
        }
        if (isPrivateEndpoint(config.endpoint())) {
            log.debug("Skipping connectivity check for private endpoint {}", config.endpoint());
        } else if (!networkProbe.isOnline()) {
            throw ProviderException.noNetwork();
        }
        return rateLimiter.execute(type().key(), () -> call(prompt, config));
    }

    @Override
    public ConnectionTestResult testConnection(ProviderConfig config) {
        log.info("Testing connection to {} with model {}", type().label(), config.model());
        try {
            analyze(TEST_PROMPT, config);
            return ConnectionTestResult.success(type());
        } catch (ProviderException e) {
            if (e.getKind() == ErrorKind.MALFORMED_RESPONSE) {
                // the provider answered, just not with JSON
                return ConnectionTestResult.success(type());
            }
            log.warn("Connection test for {} failed: {}", type().label(), e.getMessage());
            return ConnectionTestResult.failure(type(), e);
        }
    }

    protected abstract ExtractionPayload call(String prompt, ProviderConfig config);

    protected boolean requiresApiKey() {
        return true;
    }

    protected JsonNode readEnvelope(byte[] body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            if (root == null || !root.isObject()) {
                throw ProviderException.malformed("Provider response is not a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw ProviderException.malformed("Provider response is not valid JSON: " + e.getOriginalMessage());
        } catch (IOException e) {
            throw ProviderException.malformed("Provider response could not be read: " + e.getMessage());
        }
    }

    protected static RetryTemplate fixedDelayRetry(int maxAttempts, Duration delay) {
        return RetryTemplate.builder()
            .maxAttempts(maxAttempts)
            .fixedBackoff(Math.max(1, delay.toMillis()))
            .retryOn(RetryableProviderException.class)
            .build();
    }

    static boolean isPrivateEndpoint(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            return false;
        }
        String host;
        try {
            host = URI.create(endpoint.trim()).getHost();
        } catch (IllegalArgumentException e) {
            return false;
        }
        if (host == null) {
            return false;
        }
        host = host.toLowerCase(Locale.ROOT);
        return host.equals("localhost")
            || host.startsWith("127.")
            || host.startsWith("10.")
            || host.startsWith("192.168.");
    }
}
