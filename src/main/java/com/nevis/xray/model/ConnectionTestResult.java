package com.nevis.xray.model;

import com.nevis.xray.exception.ProviderException;

public record ConnectionTestResult(
    ProviderType provider,
    boolean success,
    ErrorKind errorKind,
    String message
) {
    public static ConnectionTestResult success(ProviderType provider) {
        return new ConnectionTestResult(provider, true, null, "Success");
    }

    public static ConnectionTestResult failure(ProviderType provider, ProviderException ex) {
        return new ConnectionTestResult(provider, false, ex.getKind(), ex.getMessage());
    }
}
