package com.flairbit.calls.models;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum LifecycleEventType {
    CALL_RINGING("call.ringing"),
    CALL_CONNECTED("call.connected"),
    CALL_ENDED("call.ended"),
    CALL_MISSED("call.missed"),
    CALL_FAILED("call.failed"),
    CALL_FLAGGED("call.flagged"),
    RECORDING_STARTED("recording.started"),
    RECORDING_PAUSED("recording.paused"),
    RECORDING_RESUMED("recording.resumed"),
    RECORDING_STOPPED("recording.stopped"),
    RECORDING_READY("recording.ready"),
    RECORDING_FAILED("recording.failed"),
    RECORDING_PURGED("recording.purged"),
    ESCALATION_RAISED("escalation.raised"),
    ESCALATION_ACKNOWLEDGED("escalation.acknowledged");

    @JsonValue
    private final String value;

    public static LifecycleEventType forCallStatus(CallStatus status) {
        return switch (status) {
            case RINGING -> CALL_RINGING;
            case CONNECTED -> CALL_CONNECTED;
            case ENDED -> CALL_ENDED;
            case MISSED -> CALL_MISSED;
            case FAILED -> CALL_FAILED;
            case INITIATED -> throw new IllegalArgumentException("No lifecycle event for initiated");
        };
    }

    public static LifecycleEventType fromValue(String value) {
        for (LifecycleEventType t : values()) {
            if (t.value.equals(value)) return t;
        }
        throw new IllegalArgumentException("Unknown lifecycle event: " + value);
    }
}
