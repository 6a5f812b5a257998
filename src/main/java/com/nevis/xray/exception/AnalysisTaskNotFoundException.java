package com.nevis.xray.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class AnalysisTaskNotFoundException extends RuntimeException {
    private final UUID taskId;

    public AnalysisTaskNotFoundException(UUID taskId) {
        super("Analysis task not found: " + taskId);
        this.taskId = taskId;
    }
}
