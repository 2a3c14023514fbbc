package com.flairbit.calls.models;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum SegmentUploadStatus {
    OPEN("open"),
    PENDING("pending"),
    UPLOADED("uploaded"),
    FAILED("failed");

    @JsonValue
    private final String value;

    public static SegmentUploadStatus fromValue(String value) {
        for (SegmentUploadStatus s : values()) {
            if (s.value.equalsIgnoreCase(value)) return s;
        }
        throw new IllegalArgumentException("Unknown segment upload status: " + value);
    }
}
