package com.flairbit.calls.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CallEventOutbox {
    private long cursor;
    private UUID eventId;
    private LifecycleEventType type;
    private UUID callId;
    private UUID recordingId;
    private String payload;
    private Instant createdAt;
    private int retryCount;
    private Instant nextRetryAt;
}
