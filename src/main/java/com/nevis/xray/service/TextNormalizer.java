package com.nevis.xray.service;

import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Name canonicalization and free-text cleanup shared by normalization and merging.
 */
public final class TextNormalizer {

    private static final Pattern ASCII_PARENS = Pattern.compile("\\([^)]*\\)");
    private static final Pattern FULL_WIDTH_PARENS = Pattern.compile("（[^）]*）");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern BOLD = Pattern.compile("\\*\\*(.*?)\\*\\*");
    private static final Pattern ITALIC = Pattern.compile("\\*(.*?)\\*");
    private static final Pattern HEADER = Pattern.compile("##+ ");
    private static final Pattern MULTI_SPACE = Pattern.compile(" {2,}");
    private static final Pattern OCCUPATION_SEPARATOR = Pattern.compile("[/\\\\]+");

    static final int DUPLICATE_PREFIX_LENGTH = 50;

    private TextNormalizer() {
    }

    /**
     * Identity used for deduplication: parenthetical content removed, lowercased,
     * trimmed, inner whitespace collapsed.
     */
    public static String canonicalName(String name) {
        if (name == null) {
            return "";
        }
        String stripped = FULL_WIDTH_PARENS.matcher(ASCII_PARENS.matcher(name).replaceAll("")).replaceAll("");
        return WHITESPACE.matcher(stripped.toLowerCase(Locale.ROOT).strip()).replaceAll(" ");
    }

    /**
     * Removes markdown emphasis and headers and flattens whitespace.
     */
    public static String cleanText(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = BOLD.matcher(text).replaceAll("$1");
        cleaned = ITALIC.matcher(cleaned).replaceAll("$1");
        cleaned = HEADER.matcher(cleaned).replaceAll("");
        cleaned = cleaned.replace("\\n", " ").replace("\r", " ").replace("\n", " ");
        cleaned = MULTI_SPACE.matcher(cleaned).replaceAll(" ");
        return cleaned.strip();
    }

    public static String generateId(String prefix, String name) {
        if (name == null || name.isEmpty()) {
            return prefix + "_unknown";
        }
        String hash = DigestUtils.md5DigestAsHex(name.getBytes(StandardCharsets.UTF_8));
        return prefix + "_" + hash.substring(0, 8);
    }

    public static List<String> splitOccupation(String occupation) {
        if (occupation == null || occupation.isBlank()) {
            return List.of();
        }
        List<String> parts = new ArrayList<>();
        for (String part : OCCUPATION_SEPARATOR.split(occupation)) {
            String trimmed = part.strip();
            if (!trimmed.isEmpty()) {
                parts.add(trimmed);
            }
        }
        return parts.isEmpty() ? List.of(occupation.strip()) : parts;
    }

    /**
     * Appends {@code addition} unless its first characters already occur in {@code existing}.
     */
    public static String appendIfNew(String existing, String addition) {
        String base = existing == null ? "" : existing;
        String candidate = cleanText(addition);
        if (candidate.isEmpty()) {
            return base;
        }
        if (!base.isEmpty() && base.contains(prefix(candidate, DUPLICATE_PREFIX_LENGTH))) {
            return base;
        }
        return cleanText(base + " " + candidate);
    }

    static String prefix(String text, int codePoints) {
        if (text.codePointCount(0, text.length()) <= codePoints) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, codePoints));
    }
}
