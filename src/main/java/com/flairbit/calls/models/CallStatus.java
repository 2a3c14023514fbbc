package com.flairbit.calls.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.EnumSet;
import java.util.Set;

@Getter
@RequiredArgsConstructor
public enum CallStatus {
    INITIATED("initiated", false),
    RINGING("ringing", false),
    CONNECTED("connected", false),
    ENDED("ended", true),
    MISSED("missed", true),
    FAILED("failed", true);

    @JsonValue
    private final String value;
    private final boolean terminal;

    public static final Set<CallStatus> ACTIVE = EnumSet.of(INITIATED, RINGING, CONNECTED);

    public boolean canTransitionTo(CallStatus next) {
        return switch (this) {
            case INITIATED -> next == RINGING || next == FAILED;
            case RINGING -> next == CONNECTED || next == MISSED || next == FAILED;
            case CONNECTED -> next == ENDED || next == FAILED;
            case ENDED, MISSED, FAILED -> false;
        };
    }

    @JsonCreator
    public static CallStatus fromValue(String value) {
        for (CallStatus s : values()) {
            if (s.value.equalsIgnoreCase(value)) return s;
        }
        throw new IllegalArgumentException("Unknown call status: " + value);
    }
}
