package com.flairbit.calls.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum CallType {
    SCHEDULED("scheduled"),
    CONSULTATION("consultation"),
    EMERGENCY("emergency");

    @JsonValue
    private final String value;

    @JsonCreator
    public static CallType fromValue(String value) {
        for (CallType t : values()) {
            if (t.value.equalsIgnoreCase(value)) return t;
        }
        throw new IllegalArgumentException("Unknown call type: " + value);
    }
}
