package com.nevis.xray.service;

import com.nevis.xray.model.CharacterEntry;
import com.nevis.xray.model.HistoricalFigureEntry;
import com.nevis.xray.model.LocationEntry;

import java.util.List;

/**
 * Provider payload after shape resolution: every alias and alternative layout has
 * been mapped onto one form, but nothing is deduplicated or assigned an id yet.
 */
record NormalizedExtraction(
    String bookTitle,
    String author,
    String authorBio,
    String summary,
    List<CharacterEntry> characters,
    List<HistoricalFigureEntry> historicalFigures,
    List<LocationEntry> locations,
    List<String> themes,
    List<PendingEvent> timeline
) {

    /**
     * Timeline event whose sequence number is only known when explicitly provided.
     */
    record PendingEvent(
        Integer sequence,
        String event,
        String chapter,
        String importance,
        List<String> characters,
        Integer percent
    ) {}

    boolean isEmpty() {
        return characters.isEmpty() && historicalFigures.isEmpty() && locations.isEmpty()
            && themes.isEmpty() && timeline.isEmpty()
            && isBlank(bookTitle) && isBlank(author) && isBlank(authorBio) && isBlank(summary);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
