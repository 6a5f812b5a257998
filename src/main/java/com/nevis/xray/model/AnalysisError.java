package com.nevis.xray.model;

import com.nevis.xray.exception.ProviderException;

public record AnalysisError(
    ErrorKind kind,
    Integer statusCode,
    String message
) {
    public static AnalysisError from(ProviderException ex) {
        return new AnalysisError(ex.getKind(), ex.getStatusCode(), ex.getMessage());
    }

    public static AnalysisError of(ErrorKind kind, String message) {
        return new AnalysisError(kind, null, message);
    }
}
