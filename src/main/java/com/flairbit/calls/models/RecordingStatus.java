package com.flairbit.calls.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum RecordingStatus {
    IDLE("idle"),
    RECORDING("recording"),
    PAUSED("paused"),
    STOPPED("stopped"),
    UPLOADING("uploading"),
    READY("ready"),
    FAILED("failed");

    @JsonValue
    private final String value;

    /** Capturing media or holding an open segment that can still be resumed. */
    public boolean isLive() {
        return this == RECORDING || this == PAUSED;
    }

    @JsonCreator
    public static RecordingStatus fromValue(String value) {
        for (RecordingStatus s : values()) {
            if (s.value.equalsIgnoreCase(value)) return s;
        }
        throw new IllegalArgumentException("Unknown recording status: " + value);
    }
}
