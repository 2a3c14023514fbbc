package com.flairbit.calls.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum AccessAction {
    VIEW("view"),
    DOWNLOAD("download"),
    PURGED("purged"),
    LEGAL_HOLD("legal_hold"),
    LEGAL_HOLD_RELEASED("legal_hold_released");

    @JsonValue
    private final String value;

    @JsonCreator
    public static AccessAction fromValue(String value) {
        for (AccessAction a : values()) {
            if (a.value.equalsIgnoreCase(value)) return a;
        }
        throw new IllegalArgumentException("Unknown access action: " + value);
    }
}
