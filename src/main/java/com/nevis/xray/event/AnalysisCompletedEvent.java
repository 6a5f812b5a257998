package com.nevis.xray.event;

public record AnalysisCompletedEvent(String documentId, int percent, boolean degraded) {}
