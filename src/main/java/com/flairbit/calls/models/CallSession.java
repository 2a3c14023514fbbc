package com.flairbit.calls.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CallSession {
    private UUID id;
    private UUID initiatorId;
    private UUID counterpartId;
    private UUID escalatedToId;
    private CallStatus status;
    private int escalationLevel;
    private CallType callType;
    private MediaFormat mode;
    private String context;
    private Instant createdAt;
    private Instant ringingAt;
    private Instant answeredAt;
    private Instant endedAt;
    private String endReason;
    private Instant lastSignalAt;
    private Instant initiatorLastSeenAt;
    private Instant counterpartLastSeenAt;
    private Instant flaggedAt;
    private UUID flaggedBy;
    private String flagReason;

    public boolean isParticipant(UUID userId) {
        return initiatorId.equals(userId) || counterpartId.equals(userId);
    }

    public UUID otherParticipant(UUID userId) {
        return initiatorId.equals(userId) ? counterpartId : initiatorId;
    }

    public boolean isFlagged() {
        return flaggedAt != null;
    }

    public Instant lastActivityAt() {
        return lastSignalAt != null ? lastSignalAt : createdAt;
    }
}
