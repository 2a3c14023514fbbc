package com.flairbit.calls.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscalationEvent {
    private UUID id;
    private UUID callId;
    private UUID ruleId;
    private int level;
    private Instant triggeredAt;
    private UUID acknowledgedBy;
    private Instant acknowledgedAt;

    public boolean isAcknowledged() {
        return acknowledgedAt != null;
    }
}
