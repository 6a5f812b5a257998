package com.nevis.xray.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record TimelineEvent(
    int sequence,
    String event,
    String chapter,
    String importance,
    List<String> characters,
    Integer percent
) {
    public TimelineEvent {
        characters = characters == null ? List.of() : List.copyOf(characters);
    }

    public TimelineEvent withPercent(Integer value) {
        return new TimelineEvent(sequence, event, chapter, importance, characters, value);
    }
}
