package com.nevis.xray.listener;

import com.nevis.xray.config.SyncProperties;
import com.nevis.xray.event.AnalysisCompletedEvent;
import com.nevis.xray.service.RemoteCacheSyncService;
import com.nevis.xray.service.SyncReport;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.nio.file.Path;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CacheSyncEventListenerTest {

    private final RemoteCacheSyncService syncService = Mockito.mock(RemoteCacheSyncService.class);

    @Test
    void shouldUploadWhenAutoUploadEnabled() {
        CacheSyncEventListener listener = new CacheSyncEventListener(syncService,
            new SyncProperties(true, Path.of("remote"), "xray"));
        when(syncService.upload("novel-1", null)).thenReturn(new SyncReport(2, 0, List.of()));

        listener.handleAnalysisCompleted(new AnalysisCompletedEvent("novel-1", 40, false));

        verify(syncService).upload("novel-1", null);
    }

    @Test
    void shouldStayIdleWhenAutoUploadDisabled() {
        CacheSyncEventListener listener = new CacheSyncEventListener(syncService,
            new SyncProperties(false, Path.of("remote"), "xray"));

        listener.handleAnalysisCompleted(new AnalysisCompletedEvent("novel-1", 40, false));

        verify(syncService, never()).upload(any(), isNull());
    }
}
