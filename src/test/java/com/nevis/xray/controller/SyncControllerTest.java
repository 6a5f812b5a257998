package com.nevis.xray.controller;

import com.nevis.xray.service.RemoteCacheSyncService;
import com.nevis.xray.service.SyncReport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SyncController.class)
class SyncControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private RemoteCacheSyncService syncService;

    @Test
    @DisplayName("POST /documents/{id}/sync/upload should return the per-file tally")
    void upload_ShouldReturnReport() throws Exception {
        when(syncService.upload(eq("novel-1"), isNull())).thenReturn(new SyncReport(3, 0, List.of()));

        mockMvc.perform(post("/documents/{id}/sync/upload", "novel-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.succeeded").value(3))
            .andExpect(jsonPath("$.failed").value(0));
    }

    @Test
    @DisplayName("POST /documents/{id}/sync/download should pass the folder and list errors")
    void download_ShouldReturnErrors() throws Exception {
        when(syncService.download("novel-1", "shared"))
            .thenReturn(new SyncReport(1, 1, List.of("40%.json (500) <- shared/abc/xray_analysis/40%.json")));

        mockMvc.perform(post("/documents/{id}/sync/download", "novel-1").param("folder", "shared"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.succeeded").value(1))
            .andExpect(jsonPath("$.errors[0]").value("40%.json (500) <- shared/abc/xray_analysis/40%.json"));
    }
}
