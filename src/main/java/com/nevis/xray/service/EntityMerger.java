package com.nevis.xray.service;

import com.nevis.xray.model.CharacterEntry;
import com.nevis.xray.model.ExtractionPayload;
import com.nevis.xray.model.HistoricalFigureEntry;
import com.nevis.xray.model.LocationEntry;
import com.nevis.xray.model.Snapshot;
import com.nevis.xray.model.TimelineEvent;
import com.nevis.xray.service.NormalizedExtraction.PendingEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Folds a provider payload into an accumulated snapshot. Entities are keyed by
 * canonical name, so "John" and "John (narrator)" end up as one character.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EntityMerger {

    static final String CHARACTER_PREFIX = "char";
    static final String LOCATION_PREFIX = "loc";
    static final String HISTORICAL_PREFIX = "hist";

    private static final String LEGACY_NOT_SPECIFIED = "未指定";

    private final ExtractionNormalizer normalizer;
    private final PromptCatalog prompts;

    public Snapshot merge(Snapshot current, ExtractionPayload payload) {
        return merge(current, payload, null);
    }

    /**
     * @param percentMarker stamped on new timeline events that carry no percent of their own
     */
    public Snapshot merge(Snapshot current, ExtractionPayload payload, Integer percentMarker) {
        Snapshot base = current == null ? Snapshot.empty(null, null) : current;
        if (payload == null || payload.isEmpty()) {
            return base;
        }
        NormalizedExtraction extraction = normalizer.normalize(payload.json());
        if (extraction.isEmpty()) {
            return base;
        }

        Snapshot merged = new Snapshot(
            firstMeaningful(base.bookTitle(), extraction.bookTitle(), prompts.fallback().unknownBook()),
            firstMeaningful(base.author(), extraction.author(), prompts.fallback().unknownAuthor()),
            isBlank(base.authorBio()) ? extraction.authorBio() : base.authorBio(),
            isBlank(extraction.summary()) ? base.summary() : extraction.summary(),
            mergeCharacters(base.characters(), extraction.characters()),
            mergeLocations(base.locations(), extraction.locations()),
            mergeThemes(base.themes(), extraction.themes()),
            appendTimeline(base.timeline(), extraction.timeline(), percentMarker),
            mergeHistoricalFigures(base.historicalFigures(), extraction.historicalFigures()),
            base.analysisProgress(),
            base.cacheVersion(),
            base.cachedAt()
        );
        log.debug("Merged payload: {} characters, {} locations, {} events",
            merged.characters().size(), merged.locations().size(), merged.timeline().size());
        return merged;
    }

    private List<CharacterEntry> mergeCharacters(List<CharacterEntry> existing, List<CharacterEntry> incoming) {
        Map<String, CharacterEntry> byName = new LinkedHashMap<>();
        for (CharacterEntry entry : existing) {
            byName.merge(TextNormalizer.canonicalName(entry.name()), entry, this::combine);
        }
        for (CharacterEntry entry : incoming) {
            String key = TextNormalizer.canonicalName(entry.name());
            if (key.isEmpty()) {
                continue;
            }
            byName.merge(key, fresh(entry), this::combine);
        }
        return new ArrayList<>(byName.values());
    }

    private CharacterEntry fresh(CharacterEntry entry) {
        String name = entry.name().strip();
        return new CharacterEntry(
            TextNormalizer.generateId(CHARACTER_PREFIX, name),
            name,
            isBlank(entry.role()) ? prompts.fallback().notSpecified() : entry.role().strip(),
            TextNormalizer.cleanText(entry.description()),
            entry.gender(),
            unionIgnoreCase(List.of(), entry.occupation())
        );
    }

    private CharacterEntry combine(CharacterEntry kept, CharacterEntry other) {
        String name = shorter(kept.name(), other.name());
        String role = isPlaceholderRole(kept.role()) && !isPlaceholderRole(other.role()) ? other.role() : kept.role();
        return new CharacterEntry(
            idFor(CHARACTER_PREFIX, kept.id(), kept.name(), name),
            name,
            role,
            TextNormalizer.appendIfNew(kept.description(), other.description()),
            isBlank(kept.gender()) ? other.gender() : kept.gender(),
            unionIgnoreCase(kept.occupation(), other.occupation())
        );
    }

    private List<LocationEntry> mergeLocations(List<LocationEntry> existing, List<LocationEntry> incoming) {
        Map<String, LocationEntry> byName = new LinkedHashMap<>();
        for (LocationEntry entry : existing) {
            byName.merge(TextNormalizer.canonicalName(entry.name()), entry, this::combine);
        }
        for (LocationEntry entry : incoming) {
            String key = TextNormalizer.canonicalName(entry.name());
            if (key.isEmpty()) {
                continue;
            }
            String name = entry.name().strip();
            LocationEntry created = new LocationEntry(TextNormalizer.generateId(LOCATION_PREFIX, name), name,
                TextNormalizer.cleanText(entry.description()), entry.importance());
            byName.merge(key, created, this::combine);
        }
        return new ArrayList<>(byName.values());
    }

    private LocationEntry combine(LocationEntry kept, LocationEntry other) {
        String name = shorter(kept.name(), other.name());
        return new LocationEntry(
            idFor(LOCATION_PREFIX, kept.id(), kept.name(), name),
            name,
            TextNormalizer.appendIfNew(kept.description(), other.description()),
            isBlank(kept.importance()) ? other.importance() : kept.importance()
        );
    }

    private List<HistoricalFigureEntry> mergeHistoricalFigures(List<HistoricalFigureEntry> existing,
                                                               List<HistoricalFigureEntry> incoming) {
        Map<String, HistoricalFigureEntry> byName = new LinkedHashMap<>();
        for (HistoricalFigureEntry entry : existing) {
            byName.merge(TextNormalizer.canonicalName(entry.name()), entry, this::combine);
        }
        for (HistoricalFigureEntry entry : incoming) {
            String key = TextNormalizer.canonicalName(entry.name());
            if (key.isEmpty()) {
                continue;
            }
            String name = entry.name().strip();
            HistoricalFigureEntry created = new HistoricalFigureEntry(
                TextNormalizer.generateId(HISTORICAL_PREFIX, name), name,
                TextNormalizer.cleanText(entry.biography()), entry.role(),
                entry.importanceInBook(), TextNormalizer.cleanText(entry.contextInBook()));
            byName.merge(key, created, this::combine);
        }
        return new ArrayList<>(byName.values());
    }

    private HistoricalFigureEntry combine(HistoricalFigureEntry kept, HistoricalFigureEntry other) {
        String name = shorter(kept.name(), other.name());
        return new HistoricalFigureEntry(
            idFor(HISTORICAL_PREFIX, kept.id(), kept.name(), name),
            name,
            TextNormalizer.appendIfNew(kept.biography(), other.biography()),
            isBlank(kept.role()) ? other.role() : kept.role(),
            isBlank(kept.importanceInBook()) ? other.importanceInBook() : kept.importanceInBook(),
            isBlank(kept.contextInBook()) ? other.contextInBook() : kept.contextInBook()
        );
    }

    private static String idFor(String prefix, String keptId, String keptName, String name) {
        if (name.equals(keptName) && !isBlank(keptId)) {
            return keptId;
        }
        return TextNormalizer.generateId(prefix, name);
    }

    private static List<String> mergeThemes(List<String> existing, List<String> incoming) {
        Set<String> themes = new LinkedHashSet<>();
        for (String theme : existing) {
            addTrimmed(themes, theme);
        }
        for (String theme : incoming) {
            addTrimmed(themes, theme);
        }
        return new ArrayList<>(themes);
    }

    private static void addTrimmed(Set<String> target, String value) {
        if (value != null && !value.isBlank()) {
            target.add(value.strip());
        }
    }

    private static List<TimelineEvent> appendTimeline(List<TimelineEvent> existing, List<PendingEvent> incoming,
                                                      Integer percentMarker) {
        if (incoming.isEmpty()) {
            return existing;
        }
        List<TimelineEvent> timeline = new ArrayList<>(existing);
        int position = 0;
        for (PendingEvent pending : incoming) {
            position++;
            int sequence = pending.sequence() != null ? pending.sequence() : existing.size() + position;
            Integer percent = pending.percent() != null ? pending.percent() : percentMarker;
            timeline.add(new TimelineEvent(sequence, pending.event(), pending.chapter(), pending.importance(),
                pending.characters(), percent));
        }
        return timeline;
    }

    private static List<String> unionIgnoreCase(List<String> existing, List<String> incoming) {
        Map<String, String> union = new LinkedHashMap<>();
        for (String value : existing) {
            addCaseInsensitive(union, value);
        }
        for (String value : incoming) {
            addCaseInsensitive(union, value);
        }
        return new ArrayList<>(union.values());
    }

    private static void addCaseInsensitive(Map<String, String> target, String value) {
        if (value != null && !value.isBlank()) {
            target.putIfAbsent(value.strip().toLowerCase(Locale.ROOT), value.strip());
        }
    }

    private boolean isPlaceholderRole(String role) {
        return isBlank(role) || LEGACY_NOT_SPECIFIED.equals(role) || prompts.fallback().notSpecified().equals(role);
    }

    private static String shorter(String kept, String candidate) {
        if (isBlank(candidate)) {
            return kept;
        }
        if (isBlank(kept)) {
            return candidate.strip();
        }
        return candidate.strip().length() < kept.length() ? candidate.strip() : kept;
    }

    private static String firstMeaningful(String current, String candidate, String placeholder) {
        boolean currentMissing = isBlank(current) || current.equals(placeholder);
        if (currentMissing && !isBlank(candidate) && !candidate.equals(placeholder)) {
            return candidate;
        }
        return current;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
