package com.flairbit.calls.dto;

import com.flairbit.calls.models.CallSession;
import com.flairbit.calls.models.CallStatus;
import com.flairbit.calls.models.CallType;
import com.flairbit.calls.models.MediaFormat;
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
public class CallSessionResponse {
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
    private Instant answeredAt;
    private Instant endedAt;
    private String endReason;
    private Instant flaggedAt;
    private String flagReason;

    public static CallSessionResponse from(CallSession s) {
        return CallSessionResponse.builder()
                .id(s.getId())
                .initiatorId(s.getInitiatorId())
                .counterpartId(s.getCounterpartId())
                .escalatedToId(s.getEscalatedToId())
                .status(s.getStatus())
                .escalationLevel(s.getEscalationLevel())
                .callType(s.getCallType())
                .mode(s.getMode())
                .context(s.getContext())
                .createdAt(s.getCreatedAt())
                .answeredAt(s.getAnsweredAt())
                .endedAt(s.getEndedAt())
                .endReason(s.getEndReason())
                .flaggedAt(s.getFlaggedAt())
                .flagReason(s.getFlagReason())
                .build();
    }
}
