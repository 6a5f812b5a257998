package com.nevis.xray.infra;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.Refill;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Requests-per-minute limiter with one bucket per key (one key per provider).
 * Blocks the caller until a permit is available.
 */
@Slf4j
public class InMemoryRpmRateLimiter implements RateLimiter {

    private final ConcurrentHashMap<String, Bucket> buckets = new ConcurrentHashMap<>();

    private final int rpmLimit;

    public InMemoryRpmRateLimiter(int rpmLimit) {
        if (rpmLimit < 1) {
            throw new IllegalArgumentException("RPM limit must be positive");
        }
        this.rpmLimit = rpmLimit;
    }

    private Bucket createBucket() {
        return Bucket.builder()
            .addLimit(Bandwidth.classic(rpmLimit, Refill.greedy(rpmLimit, Duration.ofMinutes(1))))
            .build();
    }

    @Override
    public void acquire(String key) {
        Bucket bucket = buckets.computeIfAbsent(key, k -> createBucket());
        if (bucket.tryConsume(1)) {
            return;
        }
        log.info("Rate limit reached for {}, waiting for a permit", key);
        try {
            bucket.asBlocking().consume(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for rate limit permit: " + key, e);
        }
    }
}
