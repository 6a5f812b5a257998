package com.nevis.xray.controller;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.xray.model.AnalysisError;
import com.nevis.xray.model.AnalysisOutcome;
import com.nevis.xray.model.AnalysisState;
import com.nevis.xray.model.ProgressEvent;
import com.nevis.xray.model.Snapshot;
import com.nevis.xray.service.AnalysisTask;

import java.time.Instant;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnalysisTaskResponse(
    @JsonProperty("task_id")
    UUID taskId,

    @JsonProperty("document_id")
    String documentId,

    @JsonProperty("target_percent")
    int targetPercent,

    String provider,

    AnalysisState state,

    @JsonProperty("chunk_index")
    Integer chunkIndex,

    @JsonProperty("total_chunks")
    Integer totalChunks,

    Boolean degraded,

    AnalysisError error,

    Snapshot snapshot,

    @JsonProperty("created_at")
    Instant createdAt
) {

    public static AnalysisTaskResponse from(AnalysisTask task) {
        ProgressEvent progress = task.getLastProgress();
        AnalysisOutcome outcome = task.outcome().orElse(null);

        Boolean degraded = null;
        AnalysisError error = null;
        if (outcome instanceof AnalysisOutcome.Completed completed) {
            degraded = completed.degraded();
            error = completed.warning();
        } else if (outcome instanceof AnalysisOutcome.Failed failed) {
            error = failed.error();
        }

        return new AnalysisTaskResponse(
            task.getId(),
            task.getDocumentId(),
            task.getTargetPercent(),
            task.getProvider().key(),
            outcome != null ? outcome.state() : task.getState(),
            progress != null ? progress.chunkIndex() : null,
            progress != null ? progress.totalChunks() : null,
            degraded,
            error,
            outcome != null ? outcome.snapshot().orElse(null) : null,
            task.getCreatedAt()
        );
    }
}
