package com.flairbit.calls.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.flairbit.calls.models.LifecycleEventType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Lifecycle event as seen by consumers. Delivery is at-least-once: consumers dedupe on
 * {@code eventId} and resume from {@code cursor}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CallEventMessage {
    private long cursor;
    private UUID eventId;
    private LifecycleEventType type;
    private UUID callId;
    private UUID recordingId;
    private Instant occurredAt;
    private JsonNode data;
}
