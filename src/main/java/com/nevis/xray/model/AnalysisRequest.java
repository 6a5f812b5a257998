package com.nevis.xray.model;

/**
 * Input of one analysis session.
 *
 * @param documentId       identity the partial cache is keyed by
 * @param source           full document text
 * @param targetPercent    how far the reader has read, 1..100
 * @param existingSnapshot optional snapshot the caller already holds
 */
public record AnalysisRequest(
    String documentId,
    String title,
    String author,
    TextSource source,
    int targetPercent,
    ProviderConfig providerConfig,
    Snapshot existingSnapshot
) {
    public AnalysisRequest {
        if (targetPercent < 1 || targetPercent > 100) {
            throw new IllegalArgumentException("Target percent must be within 1..100, got " + targetPercent);
        }
        if (documentId == null || documentId.isBlank()) {
            throw new IllegalArgumentException("Document id must not be empty");
        }
    }
}
