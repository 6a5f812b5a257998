package com.nevis.xray.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record HistoricalFigureEntry(
    String id,
    String name,
    String biography,
    String role,
    @JsonProperty("importance_in_book") String importanceInBook,
    @JsonProperty("context_in_book") String contextInBook
) {}
