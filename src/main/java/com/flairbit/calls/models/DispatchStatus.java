package com.flairbit.calls.models;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum DispatchStatus {
    PENDING("pending"),
    SENT("sent"),
    FAILED("failed");

    @JsonValue
    private final String value;

    public static DispatchStatus fromValue(String value) {
        for (DispatchStatus s : values()) {
            if (s.value.equalsIgnoreCase(value)) return s;
        }
        throw new IllegalArgumentException("Unknown dispatch status: " + value);
    }
}
