package com.flairbit.calls.dto;

import com.flairbit.calls.models.EscalationEvent;
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
public class EscalationEventResponse {
    private UUID id;
    private UUID callId;
    private UUID ruleId;
    private int level;
    private Instant triggeredAt;
    private UUID acknowledgedBy;
    private Instant acknowledgedAt;

    public static EscalationEventResponse from(EscalationEvent e) {
        return EscalationEventResponse.builder()
                .id(e.getId())
                .callId(e.getCallId())
                .ruleId(e.getRuleId())
                .level(e.getLevel())
                .triggeredAt(e.getTriggeredAt())
                .acknowledgedBy(e.getAcknowledgedBy())
                .acknowledgedAt(e.getAcknowledgedAt())
                .build();
    }
}
