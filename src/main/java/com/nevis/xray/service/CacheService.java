package com.nevis.xray.service;

import com.nevis.xray.model.Snapshot;

import java.util.List;

public interface CacheService {
    List<Integer> listPercents(String documentId);
    Snapshot getPartial(String documentId, int percent);
    Snapshot syncToProgress(String documentId, int progress);
    boolean clear(String documentId);
}
