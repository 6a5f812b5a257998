package com.nevis.xray.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record CacheListResponse(
    @JsonProperty("document_id")
    String documentId,

    List<Integer> percents
) {}
