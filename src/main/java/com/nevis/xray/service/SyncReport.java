package com.nevis.xray.service;

import java.util.List;

public record SyncReport(int succeeded, int failed, List<String> errors) {
    public SyncReport {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
