package com.nevis.xray.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record CharacterEntry(
    String id,
    String name,
    String role,
    String description,
    String gender,
    List<String> occupation
) {
    public CharacterEntry {
        occupation = occupation == null ? List.of() : List.copyOf(occupation);
    }
}
