package com.nevis.xray.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Accumulated extraction result after processing some prefix of a document.
 * Empty strings and collections are left out of the serialized form.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Snapshot(
    @JsonProperty("book_title") String bookTitle,
    String author,
    @JsonProperty("author_bio") String authorBio,
    String summary,
    List<CharacterEntry> characters,
    List<LocationEntry> locations,
    List<String> themes,
    @JsonAlias("events") List<TimelineEvent> timeline,
    @JsonProperty("historical_figures") List<HistoricalFigureEntry> historicalFigures,
    @JsonProperty("analysis_progress") int analysisProgress,
    @JsonProperty("cache_version") String cacheVersion,
    @JsonProperty("cached_at") Long cachedAt
) {

    public static final String FORMAT_VERSION = "6.0";

    public Snapshot {
        characters = characters == null ? List.of() : List.copyOf(characters);
        locations = locations == null ? List.of() : List.copyOf(locations);
        themes = themes == null ? List.of() : List.copyOf(themes);
        timeline = timeline == null ? List.of() : List.copyOf(timeline);
        historicalFigures = historicalFigures == null ? List.of() : List.copyOf(historicalFigures);
    }

    public static Snapshot empty(String bookTitle, String author) {
        return new Snapshot(bookTitle, author, null, null, null, null, null, null, null, 0, null, null);
    }

    /**
     * True when at least one of characters, locations, themes or timeline holds data.
     * A provider safety block yields a structurally valid snapshot without any.
     */
    @JsonIgnore
    public boolean hasContent() {
        return !characters.isEmpty() || !locations.isEmpty() || !themes.isEmpty() || !timeline.isEmpty();
    }

    public Snapshot withProgress(int percent) {
        return new Snapshot(bookTitle, author, authorBio, summary, characters, locations, themes, timeline,
            historicalFigures, percent, cacheVersion, cachedAt);
    }

    public Snapshot withCacheMetadata(String version, Long epochSeconds) {
        return new Snapshot(bookTitle, author, authorBio, summary, characters, locations, themes, timeline,
            historicalFigures, analysisProgress, version, epochSeconds);
    }

    public Snapshot withoutCacheMetadata() {
        return withCacheMetadata(null, null);
    }
}
