package com.nevis.xray.service;

import com.nevis.xray.config.AnalysisProperties;
import com.nevis.xray.event.AnalysisCompletedEvent;
import com.nevis.xray.exception.CacheStorageException;
import com.nevis.xray.exception.ProviderException;
import com.nevis.xray.model.AnalysisError;
import com.nevis.xray.model.AnalysisOutcome;
import com.nevis.xray.model.AnalysisRequest;
import com.nevis.xray.model.AnalysisState;
import com.nevis.xray.model.Chunk;
import com.nevis.xray.model.ErrorKind;
import com.nevis.xray.model.ExtractionPayload;
import com.nevis.xray.model.PartialCacheEntry;
import com.nevis.xray.model.ProgressEvent;
import com.nevis.xray.model.ProgressSignal;
import com.nevis.xray.model.Snapshot;
import com.nevis.xray.model.TextSource;
import com.nevis.xray.repository.PartialCacheStore;
import com.nevis.xray.service.provider.ProviderClient;
import com.nevis.xray.service.provider.ProviderClientRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs one analysis session: picks the resume point, walks the remaining chunks up
 * to the reader's position, merges each reply and persists a partial after every
 * chunk so any boundary can be resumed from.
 */
@Service
@Slf4j
public class AnalysisOrchestrator {

    private final ChunkSplitter chunkSplitter;
    private final ProviderClientRegistry providers;
    private final EntityMerger merger;
    private final PartialCacheStore store;
    private final SnapshotCodec codec;
    private final PromptCatalog prompts;
    private final ApplicationEventPublisher eventPublisher;
    private final Executor executor;
    private final Duration chunkDelay;

    public AnalysisOrchestrator(ChunkSplitter chunkSplitter,
                                ProviderClientRegistry providers,
                                EntityMerger merger,
                                PartialCacheStore store,
                                SnapshotCodec codec,
                                PromptCatalog prompts,
                                ApplicationEventPublisher eventPublisher,
                                @Qualifier("analysisTaskExecutor") Executor executor,
                                AnalysisProperties properties) {
        this.chunkSplitter = chunkSplitter;
        this.providers = providers;
        this.merger = merger;
        this.store = store;
        this.codec = codec;
        this.prompts = prompts;
        this.eventPublisher = eventPublisher;
        this.executor = executor;
        this.chunkDelay = properties.chunkDelay();
    }

    /**
     * Starts the session on the analysis executor and returns immediately.
     */
    public AnalysisTask submit(AnalysisRequest request, AnalysisProgressListener listener) {
        AnalysisTask task = new AnalysisTask(request.documentId(), request.targetPercent(),
            request.providerConfig().type());
        try {
            executor.execute(() -> task.complete(run(request, listener, task)));
        } catch (RejectedExecutionException e) {
            log.error("Analysis queue rejected task {} for document {}", task.getId(), request.documentId(), e);
            task.complete(new AnalysisOutcome.Failed(AnalysisError.of(ErrorKind.INTERNAL, "Analysis queue is full")));
        }
        log.info("Submitted analysis task {} for document {} up to {}%",
            task.getId(), request.documentId(), request.targetPercent());
        return task;
    }

    /**
     * Runs the session on the calling thread.
     */
    public AnalysisOutcome analyze(AnalysisRequest request, AnalysisProgressListener listener) {
        AnalysisTask task = new AnalysisTask(request.documentId(), request.targetPercent(),
            request.providerConfig().type());
        AnalysisOutcome outcome = run(request, listener, task);
        task.complete(outcome);
        return outcome;
    }

    AnalysisOutcome run(AnalysisRequest request, AnalysisProgressListener listener, AnalysisTask task) {
        try {
            return process(request, listener == null ? AnalysisProgressListener.NONE : listener, task);
        } catch (RuntimeException e) {
            log.error("Analysis of document {} crashed", request.documentId(), e);
            return new AnalysisOutcome.Failed(AnalysisError.of(ErrorKind.INTERNAL, "Analysis failed: " + e.getMessage()));
        }
    }

    private AnalysisOutcome process(AnalysisRequest request, AnalysisProgressListener listener, AnalysisTask task) {
        TextSource source = request.source();
        long total = source.length();
        if (total == 0) {
            log.warn("Document {} has no text", request.documentId());
            return new AnalysisOutcome.Failed(AnalysisError.of(ErrorKind.NO_TEXT, "Book text is empty"));
        }

        task.transition(AnalysisState.RESOLVING);
        int target = request.targetPercent();
        long targetByte = ChunkSplitter.alignBackward(source, total * target / 100);
        ResumePoint resume = resolve(request);

        if (resume.percent() >= target) {
            log.info("Cache for document {} already covers {}%", request.documentId(), target);
            return complete(request, resume.snapshot());
        }

        long startOffset = resume.percent() == 0 ? 0 : ChunkSplitter.alignForward(source, targetByte * resume.percent() / target);
        if (startOffset >= targetByte) {
            log.info("Nothing left to read for document {} below {}%", request.documentId(), target);
            return complete(request, resume.snapshot() != null ? resume.snapshot() : emptySnapshot(request));
        }

        List<Chunk> chunks = chunkSplitter.split(source, startOffset, targetByte);
        ProviderClient client = providers.get(request.providerConfig().type());
        log.info("Document {}: resuming at {}% (byte {}), {} chunks up to byte {} ({}%) via {}",
            request.documentId(), resume.percent(), startOffset, chunks.size(), targetByte, target,
            client.type().label());

        Snapshot lastGood = resume.snapshot();
        long processed = startOffset;

        for (Chunk chunk : chunks) {
            ProgressEvent event = new ProgressEvent(chunk.index(), chunks.size());
            task.progress(event);
            if (task.isCancelRequested() || listener.onProgress(event) == ProgressSignal.ABORT) {
                log.info("Analysis of document {} aborted before chunk {}/{}",
                    request.documentId(), chunk.index(), chunks.size());
                return new AnalysisOutcome.Aborted(lastGood);
            }

            task.transition(AnalysisState.PROCESSING);
            ExtractionPayload payload;
            try {
                payload = client.analyze(prompt(request, lastGood, chunk), request.providerConfig());
            } catch (ProviderException e) {
                AnalysisError error = AnalysisError.from(e);
                if (lastGood == null) {
                    log.warn("Chunk {}/{} of document {} failed with no earlier progress: {}",
                        chunk.index(), chunks.size(), request.documentId(), e.getMessage());
                    return new AnalysisOutcome.Failed(error);
                }
                log.warn("Chunk {}/{} of document {} failed, keeping snapshot at {}%: {}",
                    chunk.index(), chunks.size(), request.documentId(), lastGood.analysisProgress(), e.getMessage());
                return completeDegraded(request, lastGood, error);
            }
            if (payload.blocked()) {
                log.warn("Chunk {}/{} of document {} was blocked by the provider safety filter",
                    chunk.index(), chunks.size(), request.documentId());
            }

            processed += chunk.byteLength();
            int marker = (int) (processed * target / targetByte);
            Snapshot base = lastGood != null ? lastGood : emptySnapshot(request);
            Snapshot merged = merger.merge(base, payload, marker).withProgress(marker);

            task.transition(AnalysisState.PERSISTING);
            store.save(request.documentId(), marker, codec.write(merged));
            lastGood = merged;
            log.debug("Chunk {}/{} of document {} persisted at {}%", chunk.index(), chunks.size(),
                request.documentId(), marker);

            if (chunk.index() < chunks.size() && !pause()) {
                return new AnalysisOutcome.Aborted(lastGood);
            }
        }

        return complete(request, lastGood);
    }

    private ResumePoint resolve(AnalysisRequest request) {
        int target = request.targetPercent();
        Snapshot existing = request.existingSnapshot();
        if (existing == null) {
            existing = store.loadMain(request.documentId()).orElse(null);
        }
        if (existing != null && !existing.hasContent()) {
            log.info("Ignoring snapshot at {}% for document {}: no usable content",
                existing.analysisProgress(), request.documentId());
            existing = null;
        }
        if (existing != null && existing.analysisProgress() > target) {
            log.info("Ignoring snapshot at {}% for document {}: beyond requested {}%",
                existing.analysisProgress(), request.documentId(), target);
            existing = null;
        }
        ResumePoint best = existing == null ? ResumePoint.FRESH : new ResumePoint(existing, existing.analysisProgress());

        Optional<PartialCacheEntry> cached = store.nearestAtOrBelow(request.documentId(), target - 1);
        if (cached.isPresent() && cached.get().percent() > best.percent()) {
            PartialCacheEntry entry = cached.get();
            try {
                Snapshot snapshot = codec.read(entry.content()).withProgress(entry.percent());
                best = new ResumePoint(snapshot, entry.percent());
            } catch (CacheStorageException e) {
                log.warn("Partial {}% for document {} could not be read, not resuming from it",
                    entry.percent(), request.documentId(), e);
            }
        }
        return best;
    }

    private String prompt(AnalysisRequest request, Snapshot current, Chunk chunk) {
        String title = titleOf(request);
        if (current == null) {
            return prompts.textBased(title, request.author(), chunk.text());
        }
        return prompts.incremental(title, request.author(), codec.toPromptJson(current), chunk.text());
    }

    private AnalysisOutcome complete(AnalysisRequest request, Snapshot snapshot) {
        Snapshot result = snapshot.withProgress(request.targetPercent());
        store.save(request.documentId(), request.targetPercent(), codec.write(result));
        store.saveMain(request.documentId(), result);
        log.info("Analysis of document {} completed at {}%", request.documentId(), request.targetPercent());
        eventPublisher.publishEvent(new AnalysisCompletedEvent(request.documentId(), request.targetPercent(), false));
        return new AnalysisOutcome.Completed(result);
    }

    private AnalysisOutcome completeDegraded(AnalysisRequest request, Snapshot lastGood, AnalysisError warning) {
        store.saveMain(request.documentId(), lastGood);
        eventPublisher.publishEvent(new AnalysisCompletedEvent(request.documentId(), lastGood.analysisProgress(), true));
        return new AnalysisOutcome.Completed(lastGood, warning);
    }

    private Snapshot emptySnapshot(AnalysisRequest request) {
        String author = request.author() == null || request.author().isBlank()
            ? prompts.fallback().unknownAuthor() : request.author();
        return Snapshot.empty(titleOf(request), author);
    }

    private String titleOf(AnalysisRequest request) {
        return request.title() == null || request.title().isBlank() ? prompts.fallback().unknownBook() : request.title();
    }

    private boolean pause() {
        if (chunkDelay.isZero() || chunkDelay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(chunkDelay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Interrupted between chunks, stopping");
            return false;
        }
    }

    private record ResumePoint(Snapshot snapshot, int percent) {
        static final ResumePoint FRESH = new ResumePoint(null, 0);
    }
}
