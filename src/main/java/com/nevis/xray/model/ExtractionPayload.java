package com.nevis.xray.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * Raw JSON object returned by a provider, before normalization. A blocked payload
 * is what a provider safety refusal turns into.
 */
public record ExtractionPayload(
    JsonNode json,
    boolean blocked
) {

    public static ExtractionPayload of(JsonNode json) {
        return new ExtractionPayload(json, false);
    }

    public static ExtractionPayload blockedBySafetyFilter() {
        return new ExtractionPayload(JsonNodeFactory.instance.objectNode(), true);
    }

    public boolean isEmpty() {
        return json == null || json.isEmpty();
    }
}
