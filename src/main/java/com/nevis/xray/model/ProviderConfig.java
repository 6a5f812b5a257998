package com.nevis.xray.model;

/**
 * Settings for a single provider call. Built once per request and never mutated
 * downstream.
 */
public record ProviderConfig(
    ProviderType type,
    String apiKey,
    String model,
    String endpoint
) {
    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String toString() {
        return "ProviderConfig[type=" + type + ", model=" + model + ", endpoint=" + endpoint + "]";
    }
}
