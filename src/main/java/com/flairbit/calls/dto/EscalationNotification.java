package com.flairbit.calls.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Body of every escalation alert, whatever the channel.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscalationNotification {
    private UUID escalationEventId;
    private UUID callId;
    private int level;
    private String trigger;
    private String escalateToRole;
    private String callType;
    private String callStatus;
    private String context;
    private Instant triggeredAt;

    public String summary() {
        return "[L" + level + "] " + callType + " call " + callId + " escalated to " + escalateToRole
                + " (" + trigger + ", call " + callStatus + ")";
    }
}
