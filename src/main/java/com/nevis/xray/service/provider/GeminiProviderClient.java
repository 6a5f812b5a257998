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
import com.nevis.xray.model.ProviderType;
import com.nevis.xray.service.ResponseParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.util.List;

/**
 * Google Gemini {@code generateContent} client. Retries transport failures and
 * 503/504 with a fixed delay; safety refusals become an empty payload.
 */
@Component
@Slf4j
public class GeminiProviderClient extends AbstractProviderClient {

    private static final List<String> HARM_CATEGORIES = List.of(
        "HARM_CATEGORY_HARASSMENT",
        "HARM_CATEGORY_HATE_SPEECH",
        "HARM_CATEGORY_SEXUALLY_EXPLICIT",
        "HARM_CATEGORY_DANGEROUS_CONTENT"
    );

    private final RetryTemplate retryTemplate;
    private final int maxAttempts;

    public GeminiProviderClient(RestClient providerRestClient,
                                ResponseParser responseParser,
                                ObjectMapper objectMapper,
                                NetworkProbe networkProbe,
                                @Qualifier("providerLimiter") RateLimiter providerLimiter,
                                ProviderProperties properties) {
        super(providerRestClient, responseParser, objectMapper, networkProbe, providerLimiter);
        ProviderProperties.Retry retry = properties.retry();
        this.maxAttempts = retry.transientMaxAttempts();
        this.retryTemplate = fixedDelayRetry(maxAttempts, retry.transientDelay());
    }

    @Override
    public ProviderType type() {
        return ProviderType.GEMINI;
    }

    @Override
    protected ExtractionPayload call(String prompt, ProviderConfig config) {
        String url = stripTrailingSlash(config.endpoint()) + "/" + config.model() + ":generateContent";
        ObjectNode body = requestBody(prompt);
        log.info("Calling Gemini model {} ({} prompt chars)", config.model(), prompt.length());

        try {
            return retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.info("Retrying Gemini request, attempt {} of {}", context.getRetryCount() + 1, maxAttempts);
                }
                return attempt(url, body, config);
            });
        } catch (RetryableProviderException e) {
            log.warn("Gemini request gave up after {} attempts: {}", maxAttempts, e.getMessage());
            throw ProviderException.timeout("Request timed out after " + maxAttempts + " attempts", e);
        }
    }

    private ExtractionPayload attempt(String url, ObjectNode body, ProviderConfig config) {
        byte[] responseBody;
        try {
            responseBody = restClient.post()
                .uri(url)
                .header("x-goog-api-key", config.apiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .exchange((request, response) -> {
                    int status = response.getStatusCode().value();
                    log.info("Gemini responded with status {}", status);
                    if (status == 503 || status == 504) {
                        throw new RetryableProviderException(status, "Service unavailable: " + status, null);
                    }
                    if (!response.getStatusCode().is2xxSuccessful()) {
                        throw ProviderException.status(status);
                    }
                    return response.getBody().readAllBytes();
                });
        } catch (ResourceAccessException e) {
            log.warn("Gemini connection failed: {}", e.getMessage());
            throw new RetryableProviderException(null, "Connection failed: " + e.getMessage(), e);
        }
        return interpret(readEnvelope(responseBody));
    }

    private ExtractionPayload interpret(JsonNode root) {
        JsonNode blockReason = root.path("promptFeedback").path("blockReason");
        if (!blockReason.isMissingNode() && !blockReason.isNull()) {
            log.warn("Prompt blocked by safety filter, reason: {}", blockReason.asText());
            return ExtractionPayload.blockedBySafetyFilter();
        }

        JsonNode candidates = root.path("candidates");
        if (!candidates.isArray() || candidates.isEmpty()) {
            log.warn("Gemini response has no candidates");
            throw new ProviderException(ErrorKind.PROVIDER_ERROR, "Invalid response format");
        }

        JsonNode candidate = candidates.get(0);
        if ("SAFETY".equals(candidate.path("finishReason").asText())) {
            log.warn("Response blocked by safety filter (finishReason=SAFETY)");
            return ExtractionPayload.blockedBySafetyFilter();
        }

        JsonNode text = candidate.path("content").path("parts").path(0).path("text");
        if (!text.isTextual()) {
            log.warn("Gemini candidate carries no text, finishReason={}", candidate.path("finishReason").asText());
            return ExtractionPayload.blockedBySafetyFilter();
        }
        return ExtractionPayload.of(responseParser.parse(text.asText()));
    }

    private ObjectNode requestBody(String prompt) {
        ObjectNode body = objectMapper.createObjectNode();
        body.putArray("contents")
            .addObject()
            .putArray("parts")
            .addObject()
            .put("text", prompt);

        ArrayNode safety = body.putArray("safetySettings");
        for (String category : HARM_CATEGORIES) {
            safety.addObject()
                .put("category", category)
                .put("threshold", "BLOCK_NONE");
        }

        body.putObject("generationConfig")
            .put("temperature", 0.4)
            .put("topK", 40)
            .put("topP", 0.95)
            .put("responseMimeType", "application/json");
        return body;
    }

    private static String stripTrailingSlash(String endpoint) {
        return endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
    }
}
