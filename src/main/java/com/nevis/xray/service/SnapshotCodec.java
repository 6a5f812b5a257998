package com.nevis.xray.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.xray.exception.CacheStorageException;
import com.nevis.xray.model.Snapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * JSON form of {@link Snapshot} as stored in the cache and embedded in prompts.
 * Older caches stored the timeline under {@code events}; both keys are read.
 */
@Component
@RequiredArgsConstructor
public class SnapshotCodec {

    private final ObjectMapper objectMapper;

    public String write(Snapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new CacheStorageException("Failed to serialize snapshot", e);
        }
    }

    public Snapshot read(String content) {
        try {
            Snapshot snapshot = objectMapper.readValue(content, Snapshot.class);
            if (snapshot == null) {
                throw new CacheStorageException("Snapshot content is empty");
            }
            return snapshot;
        } catch (JsonProcessingException e) {
            throw new CacheStorageException("Invalid snapshot content", e);
        }
    }

    /**
     * Snapshot as shown to the model: cache bookkeeping fields are left out.
     */
    public String toPromptJson(Snapshot snapshot) {
        return write(snapshot.withoutCacheMetadata());
    }
}
