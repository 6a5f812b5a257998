package com.nevis.xray.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record LocationEntry(
    String id,
    String name,
    String description,
    String importance
) {}
