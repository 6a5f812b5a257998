package com.nevis.xray.service;

import com.nevis.xray.model.Snapshot;

import java.util.UUID;

public interface AnalysisService {
    AnalysisTask requestAnalysis(String documentId, String title, String author, String text, int targetPercent,
                                 String provider, String model, Snapshot existingSnapshot);
    AnalysisTask getTask(UUID taskId);
    AnalysisTask cancel(UUID taskId);
}
