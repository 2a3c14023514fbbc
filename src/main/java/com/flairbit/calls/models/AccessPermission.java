package com.flairbit.calls.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum AccessPermission {
    VIEW("view"),
    DOWNLOAD("download");

    @JsonValue
    private final String value;

    /** A download grant implies view. */
    public boolean covers(AccessAction action) {
        return switch (action) {
            case VIEW -> true;
            case DOWNLOAD -> this == DOWNLOAD;
            case PURGED, LEGAL_HOLD, LEGAL_HOLD_RELEASED -> false;
        };
    }

    @JsonCreator
    public static AccessPermission fromValue(String value) {
        for (AccessPermission p : values()) {
            if (p.value.equalsIgnoreCase(value)) return p;
        }
        throw new IllegalArgumentException("Unknown permission: " + value);
    }
}
