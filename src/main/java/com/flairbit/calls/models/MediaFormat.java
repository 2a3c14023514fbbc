package com.flairbit.calls.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum MediaFormat {
    AUDIO("audio"),
    VIDEO("video"),
    SCREEN("screen");

    @JsonValue
    private final String value;

    @JsonCreator
    public static MediaFormat fromValue(String value) {
        for (MediaFormat f : values()) {
            if (f.value.equalsIgnoreCase(value)) return f;
        }
        throw new IllegalArgumentException("Unknown media format: " + value);
    }
}
