package com.nevis.xray.model;

import java.util.Arrays;
import java.util.Locale;

public enum ProviderType {

    GEMINI("gemini", "Google Gemini"),
    CHATGPT("chatgpt", "ChatGPT"),
    LOCAL("local", "Local AI");

    private final String key;
    private final String label;

    ProviderType(String key, String label) {
        this.key = key;
        this.label = label;
    }

    public String key() {
        return key;
    }

    public String label() {
        return label;
    }

    public static ProviderType fromKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Provider must not be empty");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(type -> type.key.equals(normalized) || type.name().equalsIgnoreCase(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown provider: " + value));
    }
}
