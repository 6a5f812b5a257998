package com.nevis.xray.controller;

import com.nevis.xray.exception.CacheEntryNotFoundException;
import com.nevis.xray.model.Snapshot;
import com.nevis.xray.service.CacheService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/documents/{documentId}/cache")
@RequiredArgsConstructor
public class CacheController {

    private final CacheService cacheService;

    @GetMapping
    public ResponseEntity<CacheListResponse> listPercents(@PathVariable String documentId) {
        return ResponseEntity.ok(new CacheListResponse(documentId, cacheService.listPercents(documentId)));
    }

    @GetMapping("/current")
    public ResponseEntity<Snapshot> current(
        @PathVariable String documentId,
        @RequestParam(name = "progress") int progress) {
        if (progress < 0 || progress > 100) {
            throw new IllegalArgumentException("Progress must be within 0..100, got " + progress);
        }
        return ResponseEntity.ok(cacheService.syncToProgress(documentId, progress));
    }

    @GetMapping("/{percent:\\d+}")
    public ResponseEntity<Snapshot> getPartial(@PathVariable String documentId, @PathVariable int percent) {
        return ResponseEntity.ok(cacheService.getPartial(documentId, percent));
    }

    @DeleteMapping
    public ResponseEntity<Void> clear(@PathVariable String documentId) {
        if (!cacheService.clear(documentId)) {
            throw new CacheEntryNotFoundException(documentId, null);
        }
        return ResponseEntity.noContent().build();
    }
}
