package com.nevis.xray.exception;

import lombok.Getter;

@Getter
public class CacheEntryNotFoundException extends RuntimeException {
    private final String documentId;
    private final Integer percent;

    public CacheEntryNotFoundException(String documentId, Integer percent) {
        super(percent == null
            ? "No cached analysis for document: " + documentId
            : "No cached analysis at " + percent + "% for document: " + documentId);
        this.documentId = documentId;
        this.percent = percent;
    }
}
