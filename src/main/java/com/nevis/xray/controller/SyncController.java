package com.nevis.xray.controller;

import com.nevis.xray.service.RemoteCacheSyncService;
import com.nevis.xray.service.SyncReport;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/documents/{documentId}/sync")
@RequiredArgsConstructor
public class SyncController {

    private final RemoteCacheSyncService syncService;

    @PostMapping("/upload")
    public ResponseEntity<SyncReport> upload(
        @PathVariable String documentId,
        @RequestParam(name = "folder", required = false) String folder) {
        return ResponseEntity.ok(syncService.upload(documentId, folder));
    }

    @PostMapping("/download")
    public ResponseEntity<SyncReport> download(
        @PathVariable String documentId,
        @RequestParam(name = "folder", required = false) String folder) {
        return ResponseEntity.ok(syncService.download(documentId, folder));
    }
}
