package com.nevis.xray.service;

import com.nevis.xray.exception.CacheEntryNotFoundException;
import com.nevis.xray.model.PartialCacheEntry;
import com.nevis.xray.model.Snapshot;
import com.nevis.xray.repository.PartialCacheStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class CacheServiceImpl implements CacheService {

    private final PartialCacheStore store;
    private final SnapshotCodec codec;

    @Override
    public List<Integer> listPercents(String documentId) {
        return store.list(documentId);
    }

    @Override
    public Snapshot getPartial(String documentId, int percent) {
        String content = store.get(documentId, percent)
            .orElseThrow(() -> new CacheEntryNotFoundException(documentId, percent));
        return codec.read(content);
    }

    /**
     * Makes the main snapshot match the reader's position: the best partial at or
     * below {@code progress} replaces it, which rewinds when the reader jumped back.
     */
    @Override
    public Snapshot syncToProgress(String documentId, int progress) {
        Optional<Snapshot> main = store.loadMain(documentId);
        Optional<PartialCacheEntry> partial = store.nearestAtOrBelow(documentId, progress);

        if (partial.isEmpty()) {
            return main.filter(snapshot -> snapshot.analysisProgress() <= progress)
                .orElseThrow(() -> new CacheEntryNotFoundException(documentId, null));
        }

        PartialCacheEntry entry = partial.get();
        if (main.isPresent() && main.get().analysisProgress() == entry.percent()) {
            return main.get();
        }

        log.info("Syncing main cache of document {} to {}% (reader at {}%)", documentId, entry.percent(), progress);
        Snapshot snapshot = codec.read(entry.content()).withProgress(entry.percent());
        store.saveMain(documentId, snapshot);
        return store.loadMain(documentId).orElse(snapshot);
    }

    @Override
    public boolean clear(String documentId) {
        return store.clear(documentId);
    }
}
