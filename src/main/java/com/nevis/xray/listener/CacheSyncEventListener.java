package com.nevis.xray.listener;

import com.nevis.xray.config.SyncProperties;
import com.nevis.xray.event.AnalysisCompletedEvent;
import com.nevis.xray.service.RemoteCacheSyncService;
import com.nevis.xray.service.SyncReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class CacheSyncEventListener {

    private final RemoteCacheSyncService syncService;
    private final SyncProperties properties;

    @Async("syncTaskExecutor")
    @EventListener
    public void handleAnalysisCompleted(AnalysisCompletedEvent event) {
        if (!properties.autoUpload()) {
            return;
        }
        log.info("Auto-uploading cache of document {} at {}%", event.documentId(), event.percent());
        SyncReport report = syncService.upload(event.documentId(), null);
        if (report.failed() > 0) {
            log.warn("Auto-upload of document {} had {} failures: {}", event.documentId(), report.failed(), report.errors());
        }
    }
}
