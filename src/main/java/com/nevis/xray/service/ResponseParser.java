package com.nevis.xray.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.xray.exception.ProviderException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Extracts the JSON object from a model reply that may be wrapped in markdown
 * fences or surrounded by prose.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ResponseParser {

    private final ObjectMapper objectMapper;

    public JsonNode parse(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            throw ProviderException.malformed("Empty response text");
        }
        log.debug("Parsing model reply, length: {}", rawText.length());

        String cleaned = rawText
            .replace("```json", "")
            .replace("```JSON", "")
            .replace("```", "")
            .strip();

        Optional<JsonNode> direct = tryRead(cleaned);
        if (direct.isPresent()) {
            return direct.get();
        }

        int first = cleaned.indexOf('{');
        int last = cleaned.lastIndexOf('}');
        if (first >= 0 && last > first) {
            Optional<JsonNode> embedded = tryRead(cleaned.substring(first, last + 1));
            if (embedded.isPresent()) {
                log.info("Recovered JSON object embedded in prose");
                return embedded.get();
            }
        }

        log.warn("Model reply is not valid JSON, first 200 chars: {}",
            cleaned.substring(0, Math.min(200, cleaned.length())));
        throw ProviderException.malformed("Response is not a JSON object");
    }

    private Optional<JsonNode> tryRead(String text) {
        try {
            JsonNode node = objectMapper.readTree(text);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
