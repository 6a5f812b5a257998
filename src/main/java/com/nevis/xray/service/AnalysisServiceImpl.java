package com.nevis.xray.service;

import com.nevis.xray.config.AnalysisProperties;
import com.nevis.xray.exception.AnalysisTaskNotFoundException;
import com.nevis.xray.model.AnalysisRequest;
import com.nevis.xray.model.ProviderConfig;
import com.nevis.xray.model.Snapshot;
import com.nevis.xray.model.SourceText;
import com.nevis.xray.service.provider.ProviderConfigFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Service
@Slf4j
@RequiredArgsConstructor
public class AnalysisServiceImpl implements AnalysisService {

    private final AnalysisOrchestrator orchestrator;
    private final ProviderConfigFactory providerConfigFactory;
    private final AnalysisProperties properties;

    private final Map<UUID, AnalysisTask> tasks = new ConcurrentHashMap<>();

    @Override
    public AnalysisTask requestAnalysis(String documentId, String title, String author, String text,
                                        int targetPercent, String provider, String model,
                                        Snapshot existingSnapshot) {
        ProviderConfig config = providerConfigFactory.create(provider, model);
        AnalysisRequest request = new AnalysisRequest(documentId, title, author, SourceText.of(text),
            targetPercent, config, existingSnapshot);
        AnalysisTask task = orchestrator.submit(request, AnalysisProgressListener.NONE);
        tasks.put(task.getId(), task);
        return task;
    }

    @Override
    public AnalysisTask getTask(UUID taskId) {
        AnalysisTask task = tasks.get(taskId);
        if (task == null) {
            throw new AnalysisTaskNotFoundException(taskId);
        }
        return task;
    }

    @Override
    public AnalysisTask cancel(UUID taskId) {
        AnalysisTask task = getTask(taskId);
        if (!task.isDone()) {
            log.info("Cancel requested for analysis task {}", taskId);
            task.cancel();
        }
        return task;
    }

    /**
     * Forgets finished tasks once they have been done for longer than the retention window.
     * Running tasks are never evicted.
     */
    @Scheduled(fixedDelayString = "${app.analysis.task-sweep-interval-ms:60000}")
    public void evictFinishedTasks() {
        Instant cutoff = Instant.now().minus(properties.taskRetention());
        int before = tasks.size();
        tasks.values().removeIf(task -> task.isDone()
            && task.getCompletedAt() != null
            && !task.getCompletedAt().isAfter(cutoff));
        int evicted = before - tasks.size();
        if (evicted > 0) {
            log.debug("Evicted {} finished analysis tasks", evicted);
        }
    }
}
