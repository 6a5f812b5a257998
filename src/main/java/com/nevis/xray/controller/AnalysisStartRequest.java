package com.nevis.xray.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.nevis.xray.model.Snapshot;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record AnalysisStartRequest(
    @NotBlank
    String title,

    String author,

    @NotBlank
    String text,

    @NotNull
    @Min(1)
    @Max(100)
    @JsonProperty("target_percent")
    Integer targetPercent,

    String provider,

    String model,

    @JsonProperty("existing_snapshot")
    Snapshot existingSnapshot
) {}
