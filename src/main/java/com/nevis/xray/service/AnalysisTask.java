package com.nevis.xray.service;

import com.nevis.xray.model.AnalysisOutcome;
import com.nevis.xray.model.AnalysisState;
import com.nevis.xray.model.ProgressEvent;
import com.nevis.xray.model.ProviderType;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle on a running analysis session. Cancellation is cooperative and only
 * honoured between chunks.
 */
@Getter
public class AnalysisTask {

    private final UUID id;
    private final String documentId;
    private final int targetPercent;
    private final ProviderType provider;
    private final Instant createdAt;
    private final CompletableFuture<AnalysisOutcome> future = new CompletableFuture<>();

    @Getter(AccessLevel.NONE)
    private final AtomicBoolean cancelRequested = new AtomicBoolean();
    private volatile AnalysisState state = AnalysisState.IDLE;
    private volatile ProgressEvent lastProgress;
    private volatile Instant completedAt;

    public AnalysisTask(String documentId, int targetPercent, ProviderType provider) {
        this.id = UUID.randomUUID();
        this.documentId = documentId;
        this.targetPercent = targetPercent;
        this.provider = provider;
        this.createdAt = Instant.now();
    }

    public void cancel() {
        cancelRequested.set(true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    public boolean isDone() {
        return future.isDone();
    }

    public Optional<AnalysisOutcome> outcome() {
        return Optional.ofNullable(future.getNow(null));
    }

    void transition(AnalysisState next) {
        this.state = next;
    }

    void progress(ProgressEvent event) {
        this.lastProgress = event;
    }

    void complete(AnalysisOutcome outcome) {
        this.state = outcome.state();
        this.completedAt = Instant.now();
        future.complete(outcome);
    }
}
