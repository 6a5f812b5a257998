package com.nevis.xray.model;

import java.time.Instant;

/**
 * A snapshot persisted at a reading percentage. {@code content} is the serialized
 * snapshot exactly as written.
 */
public record PartialCacheEntry(
    int percent,
    String content,
    Instant modifiedAt
) {}
