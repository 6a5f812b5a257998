package com.nevis.xray.model;

public enum AnalysisState {
    IDLE,
    RESOLVING,
    PROCESSING,
    PERSISTING,
    COMPLETED,
    ABORTED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABORTED || this == FAILED;
    }
}
