package com.nevis.xray.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.nevis.xray.model.CharacterEntry;
import com.nevis.xray.model.HistoricalFigureEntry;
import com.nevis.xray.model.LocationEntry;
import com.nevis.xray.service.NormalizedExtraction.PendingEvent;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Resolves the loosely-typed provider JSON into {@link NormalizedExtraction}.
 * Providers are inconsistent about key names, and about whether a field is a
 * string, an array or an object, so every accessor accepts each known variant.
 */
@Component
public class ExtractionNormalizer {

    public NormalizedExtraction normalize(JsonNode root) {
        if (root == null || !root.isObject()) {
            return new NormalizedExtraction(null, null, null, null,
                List.of(), List.of(), List.of(), List.of(), List.of());
        }
        return new NormalizedExtraction(
            text(root, "book_title", "title"),
            text(root, "author", "book_author"),
            cleaned(root, "author_bio", "AuthorBio", "bio"),
            cleaned(root, "summary", "book_summary"),
            characters(field(root, "characters", "Characters")),
            historicalFigures(field(root, "historical_figures", "historicalFigures")),
            locations(field(root, "locations", "Locations")),
            themes(field(root, "themes", "Themes")),
            timeline(field(root, "timeline", "events"))
        );
    }

    private List<CharacterEntry> characters(JsonNode node) {
        List<CharacterEntry> result = new ArrayList<>();
        for (JsonNode item : elements(node)) {
            if (item.isTextual()) {
                addIfNamed(result, new CharacterEntry(null, item.asText().strip(), null, null, null, null));
            } else if (item.isObject()) {
                addIfNamed(result, new CharacterEntry(
                    null,
                    text(item, "name", "Name"),
                    text(item, "role", "Role"),
                    cleaned(item, "description", "desc"),
                    text(item, "gender"),
                    occupation(item.get("occupation"))
                ));
            }
        }
        return result;
    }

    private static void addIfNamed(List<CharacterEntry> target, CharacterEntry entry) {
        if (entry.name() != null && !entry.name().isBlank()) {
            target.add(entry);
        }
    }

    private List<HistoricalFigureEntry> historicalFigures(JsonNode node) {
        List<HistoricalFigureEntry> result = new ArrayList<>();
        for (JsonNode item : elements(node)) {
            if (!item.isObject()) {
                continue;
            }
            String name = text(item, "name", "Name");
            if (name == null || name.isBlank()) {
                continue;
            }
            result.add(new HistoricalFigureEntry(
                null,
                name,
                cleaned(item, "biography", "bio"),
                text(item, "role"),
                text(item, "importance_in_book", "importance"),
                cleaned(item, "context_in_book", "context")
            ));
        }
        return result;
    }

    private List<LocationEntry> locations(JsonNode node) {
        List<LocationEntry> result = new ArrayList<>();
        if (node == null) {
            return result;
        }
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                if (value.isObject()) {
                    addLocation(result, field.getKey(),
                        cleaned(value, "description", "desc"), text(value, "importance"));
                } else {
                    addLocation(result, field.getKey(), TextNormalizer.cleanText(value.asText("")), null);
                }
            }
            return result;
        }
        for (JsonNode item : elements(node)) {
            if (item.isTextual()) {
                addLocation(result, item.asText(), null, null);
            } else if (item.isObject()) {
                addLocation(result, text(item, "name", "Name"),
                    cleaned(item, "description", "desc"), text(item, "importance"));
            }
        }
        return result;
    }

    private static void addLocation(List<LocationEntry> target, String name, String description, String importance) {
        if (name != null && !name.isBlank()) {
            target.add(new LocationEntry(null, name.strip(), description, importance));
        }
    }

    private List<String> themes(JsonNode node) {
        List<String> result = new ArrayList<>();
        for (JsonNode item : elements(node)) {
            String theme = item.isObject() ? text(item, "name", "theme") : item.asText(null);
            if (theme != null && !theme.isBlank()) {
                result.add(theme.strip());
            }
        }
        return result;
    }

    private List<PendingEvent> timeline(JsonNode node) {
        List<PendingEvent> result = new ArrayList<>();
        for (JsonNode item : elements(node)) {
            if (item.isTextual()) {
                String event = TextNormalizer.cleanText(item.asText());
                if (!event.isEmpty()) {
                    result.add(new PendingEvent(null, event, null, null, List.of(), null));
                }
                continue;
            }
            if (!item.isObject()) {
                continue;
            }
            String event = cleaned(item, "event", "description");
            String importance = cleaned(item, "importance");
            if (isBlank(event) && isBlank(importance)) {
                continue;
            }
            result.add(new PendingEvent(
                integer(item.get("sequence")),
                event,
                text(item, "chapter"),
                importance,
                stringList(item.get("characters")),
                integer(item.get("percent"))
            ));
        }
        return result;
    }

    private static List<String> occupation(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (node.isArray()) {
            return stringList(node);
        }
        return TextNormalizer.splitOccupation(node.asText());
    }

    private static List<String> stringList(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode item : node) {
                String value = item.asText("").strip();
                if (!value.isEmpty()) {
                    values.add(value);
                }
            }
        } else if (node.isTextual()) {
            for (String part : node.asText().split("[,，、]")) {
                if (!part.isBlank()) {
                    values.add(part.strip());
                }
            }
        }
        return values;
    }

    private static Integer integer(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.canConvertToInt()) {
            return node.asInt();
        }
        if (node.isTextual()) {
            try {
                return Integer.valueOf(node.asText().strip());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Iterable<JsonNode> elements(JsonNode node) {
        if (node == null || !node.isArray()) {
            return List.of();
        }
        return node;
    }

    private static JsonNode field(JsonNode node, String... keys) {
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    private static String text(JsonNode node, String... keys) {
        JsonNode value = field(node, keys);
        if (value == null || value.isContainerNode()) {
            return null;
        }
        String text = value.asText().strip();
        return text.isEmpty() ? null : text;
    }

    private static String cleaned(JsonNode node, String... keys) {
        String value = text(node, keys);
        return value == null ? null : TextNormalizer.cleanText(value);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
