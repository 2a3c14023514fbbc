package com.flairbit.calls.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum SignalKind {
    OFFER("offer"),
    ANSWER("answer"),
    ICE_CANDIDATE("ice-candidate"),
    HANGUP("hangup");

    @JsonValue
    private final String value;

    @JsonCreator
    public static SignalKind fromValue(String value) {
        for (SignalKind k : values()) {
            if (k.value.equalsIgnoreCase(value)) return k;
        }
        throw new IllegalArgumentException("Unknown signal kind: " + value);
    }
}
