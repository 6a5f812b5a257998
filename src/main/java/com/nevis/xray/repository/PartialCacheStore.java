package com.nevis.xray.repository;

import com.nevis.xray.model.PartialCacheEntry;
import com.nevis.xray.model.Snapshot;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Percent-indexed snapshots of one document, plus its consolidated main snapshot.
 */
public interface PartialCacheStore {
    void save(String documentId, int percent, String content);
    Optional<String> get(String documentId, int percent);
    List<Integer> list(String documentId);
    Optional<PartialCacheEntry> nearestAtOrBelow(String documentId, int targetPercent);
    boolean clear(String documentId);
    void saveMain(String documentId, Snapshot snapshot);
    Optional<Snapshot> loadMain(String documentId);
    Path mainFile(String documentId);
    Path partialDirectory(String documentId);
}
