package com.flairbit.calls.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum TriggerCondition {
    UNANSWERED_TIMEOUT("unanswered_timeout"),
    FLAGGED("flagged"),
    ENDPOINT_OFFLINE("endpoint_offline");

    @JsonValue
    private final String value;

    @JsonCreator
    public static TriggerCondition fromValue(String value) {
        for (TriggerCondition c : values()) {
            if (c.value.equalsIgnoreCase(value)) return c;
        }
        throw new IllegalArgumentException("Unknown trigger condition: " + value);
    }
}
