package com.nevis.xray.controller;

import com.nevis.xray.exception.CacheEntryNotFoundException;
import com.nevis.xray.exception.CacheStorageException;
import com.nevis.xray.model.CharacterEntry;
import com.nevis.xray.model.Snapshot;
import com.nevis.xray.service.CacheService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CacheController.class)
class CacheControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private CacheService cacheService;

    @Test
    @DisplayName("GET /documents/{id}/cache should list cached percents")
    void listPercents_ShouldReturnAscendingPercents() throws Exception {
        when(cacheService.listPercents("novel-1")).thenReturn(List.of(20, 40, 75));

        mockMvc.perform(get("/documents/{id}/cache", "novel-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.document_id").value("novel-1"))
            .andExpect(jsonPath("$.percents.length()").value(3))
            .andExpect(jsonPath("$.percents[0]").value(20))
            .andExpect(jsonPath("$.percents[2]").value(75));
    }

    @Test
    @DisplayName("GET /documents/{id}/cache/{percent} should return the stored snapshot")
    void getPartial_ShouldReturnSnapshot() throws Exception {
        Snapshot snapshot = new Snapshot("书名", "作者", null, null,
            List.of(new CharacterEntry("char_1", "约翰", "主角", null, null, List.of("医生"))),
            null, List.of("成长"), null, null, 40, null, null);
        when(cacheService.getPartial("novel-1", 40)).thenReturn(snapshot);

        mockMvc.perform(get("/documents/{id}/cache/{percent}", "novel-1", 40))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.analysis_progress").value(40))
            .andExpect(jsonPath("$.characters[0].name").value("约翰"))
            .andExpect(jsonPath("$.characters[0].occupation[0]").value("医生"))
            .andExpect(jsonPath("$.themes[0]").value("成长"))
            .andExpect(jsonPath("$.locations").doesNotExist());
    }

    @Test
    @DisplayName("GET /documents/{id}/cache/{percent} should return 404 when nothing is stored")
    void getPartial_ShouldReturn404_WhenMissing() throws Exception {
        when(cacheService.getPartial("novel-1", 55)).thenThrow(new CacheEntryNotFoundException("novel-1", 55));

        mockMvc.perform(get("/documents/{id}/cache/{percent}", "novel-1", 55))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.errorCode").value("RESOURCE_NOT_FOUND"));
    }

    @Test
    @DisplayName("GET /documents/{id}/cache/current should sync to the reading position")
    void current_ShouldReturnSyncedSnapshot() throws Exception {
        when(cacheService.syncToProgress("novel-1", 30)).thenReturn(Snapshot.empty("书名", "作者").withProgress(20));

        mockMvc.perform(get("/documents/{id}/cache/current", "novel-1").param("progress", "30"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.analysis_progress").value(20));
    }

    @Test
    @DisplayName("GET /documents/{id}/cache/current should require and range-check progress")
    void current_ShouldReturn400_WhenProgressInvalid() throws Exception {
        mockMvc.perform(get("/documents/{id}/cache/current", "novel-1"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("MISSING_PARAMETER"));

        mockMvc.perform(get("/documents/{id}/cache/current", "novel-1").param("progress", "101"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("BAD_REQUEST"));

        verify(cacheService, never()).syncToProgress(anyString(), anyInt());
    }

    @Test
    @DisplayName("DELETE /documents/{id}/cache should return 204 when files were removed")
    void clear_ShouldReturn204() throws Exception {
        when(cacheService.clear("novel-1")).thenReturn(true);

        mockMvc.perform(delete("/documents/{id}/cache", "novel-1"))
            .andExpect(status().isNoContent());
    }

    @Test
    @DisplayName("DELETE /documents/{id}/cache should return 404 when there was nothing to remove")
    void clear_ShouldReturn404_WhenNothingCached() throws Exception {
        when(cacheService.clear("novel-1")).thenReturn(false);

        mockMvc.perform(delete("/documents/{id}/cache", "novel-1"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.message").value("No cached analysis for document: novel-1"));
    }

    @Test
    @DisplayName("Storage failures should surface as 500 CACHE_ERROR")
    void listPercents_ShouldReturn500_WhenStorageFails() throws Exception {
        when(cacheService.listPercents("novel-1")).thenThrow(new CacheStorageException("disk full"));

        mockMvc.perform(get("/documents/{id}/cache", "novel-1"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.errorCode").value("CACHE_ERROR"));
    }
}
