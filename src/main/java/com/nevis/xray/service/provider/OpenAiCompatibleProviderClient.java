package com.nevis.xray.service.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nevis.xray.config.ProviderProperties;
import com.nevis.xray.exception.ProviderException;
import com.nevis.xray.exception.RetryableProviderException;
import com.nevis.xray.infra.NetworkProbe;
import com.nevis.xray.infra.RateLimiter;
import com.nevis.xray.model.ErrorKind;
import com.nevis.xray.model.ExtractionPayload;
import com.nevis.xray.model.ProviderConfig;
import com.nevis.xray.service.PromptCatalog;
import com.nevis.xray.service.ResponseParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

/**
 * Chat-completions client for OpenAI and servers that mimic its API. Only 429 is
 * retried; a transport failure ends the call as a timeout.
 */
@Slf4j
public abstract class OpenAiCompatibleProviderClient extends AbstractProviderClient {

    static final int MAX_TOKENS = 8192;

    private final PromptCatalog prompts;
    private final RetryTemplate retryTemplate;
    private final int maxAttempts;

    protected OpenAiCompatibleProviderClient(RestClient restClient,
                                             ResponseParser responseParser,
                                             ObjectMapper objectMapper,
                                             NetworkProbe networkProbe,
                                             RateLimiter rateLimiter,
                                             PromptCatalog prompts,
                                             ProviderProperties properties) {
        super(restClient, responseParser, objectMapper, networkProbe, rateLimiter);
        this.prompts = prompts;
        ProviderProperties.Retry retry = properties.retry();
        this.maxAttempts = retry.rateLimitMaxAttempts();
        this.retryTemplate = fixedDelayRetry(maxAttempts, retry.rateLimitDelay());
    }

    @Override
    protected ExtractionPayload call(String prompt, ProviderConfig config) {
        ObjectNode body = requestBody(prompt, config);
        log.info("Calling {} model {} at {}", type().label(), config.model(), config.endpoint());

        try {
            return retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.info("Retrying {} request after rate limit, attempt {}", type().label(), context.getRetryCount() + 1);
                }
                return attempt(body, config);
            });
        } catch (RetryableProviderException e) {
            log.warn("{} still rate limited after {} attempts", type().label(), maxAttempts);
            throw ProviderException.timeout("Rate limited after " + maxAttempts + " attempts", e);
        }
    }

    private ExtractionPayload attempt(ObjectNode body, ProviderConfig config) {
        byte[] responseBody;
        try {
            responseBody = restClient.post()
                .uri(config.endpoint())
                .headers(headers -> {
                    if (config.hasApiKey()) {
                        headers.set(HttpHeaders.AUTHORIZATION, "Bearer " + config.apiKey());
                    }
                })
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .exchange((request, response) -> {
                    int status = response.getStatusCode().value();
                    log.info("{} responded with status {}", type().label(), status);
                    if (status == 429) {
                        throw new RetryableProviderException(status, "Rate limited: 429", null);
                    }
                    if (!response.getStatusCode().is2xxSuccessful()) {
                        throw ProviderException.status(status);
                    }
                    return response.getBody().readAllBytes();
                });
        } catch (ResourceAccessException e) {
            log.warn("{} connection failed: {}", type().label(), e.getMessage());
            throw ProviderException.timeout("Connection failed: " + e.getMessage(), e);
        }
        return interpret(readEnvelope(responseBody));
    }

    private ExtractionPayload interpret(JsonNode root) {
        JsonNode choice = root.path("choices").path(0);
        if (!choice.isMissingNode()) {
            if ("content_filter".equals(choice.path("finish_reason").asText())) {
                log.warn("{} response blocked by content filter", type().label());
                return ExtractionPayload.blockedBySafetyFilter();
            }
            JsonNode message = choice.path("message");
            String refusal = message.path("refusal").asText("");
            if (!refusal.isBlank()) {
                log.warn("{} refused the request: {}", type().label(), refusal);
                return ExtractionPayload.blockedBySafetyFilter();
            }
            JsonNode content = message.path("content");
            if (content.isTextual()) {
                return ExtractionPayload.of(responseParser.parse(content.asText()));
            }
        }

        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            String detail = error.path("message").asText("API Error");
            log.warn("{} returned an error object: {}", type().label(), detail);
            throw new ProviderException(ErrorKind.PROVIDER_ERROR, detail);
        }
        throw new ProviderException(ErrorKind.PROVIDER_ERROR, "Invalid response format");
    }

    private ObjectNode requestBody(String prompt, ProviderConfig config) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", config.model());
        ArrayNode messages = body.putArray("messages");
        messages.addObject()
            .put("role", "system")
            .put("content", prompts.systemInstruction());
        messages.addObject()
            .put("role", "user")
            .put("content", prompt);
        body.put("temperature", 0.4);
        body.put("max_tokens", MAX_TOKENS);
        body.put("top_p", 0.95);
        body.putObject("response_format").put("type", "json_object");
        return body;
    }
}
