package com.nevis.xray.controller;

import com.nevis.xray.service.AnalysisService;
import com.nevis.xray.service.AnalysisTask;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequiredArgsConstructor
public class AnalysisController {

    private final AnalysisService analysisService;

    @PostMapping("/documents/{documentId}/analysis")
    public ResponseEntity<AnalysisTaskResponse> startAnalysis(
        @PathVariable String documentId,
        @Valid @RequestBody AnalysisStartRequest request) {

        AnalysisTask task = analysisService.requestAnalysis(
            documentId,
            request.title(),
            request.author(),
            request.text(),
            request.targetPercent(),
            request.provider(),
            request.model(),
            request.existingSnapshot()
        );

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(AnalysisTaskResponse.from(task));
    }

    @GetMapping("/analysis/{taskId}")
    public ResponseEntity<AnalysisTaskResponse> getTask(@PathVariable UUID taskId) {
        return ResponseEntity.ok(AnalysisTaskResponse.from(analysisService.getTask(taskId)));
    }

    @DeleteMapping("/analysis/{taskId}")
    public ResponseEntity<AnalysisTaskResponse> cancelTask(@PathVariable UUID taskId) {
        return ResponseEntity.accepted().body(AnalysisTaskResponse.from(analysisService.cancel(taskId)));
    }
}
