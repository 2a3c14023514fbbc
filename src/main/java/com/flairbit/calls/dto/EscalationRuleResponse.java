package com.flairbit.calls.dto;

import com.flairbit.calls.models.EscalationRule;
import com.flairbit.calls.models.TriggerCondition;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscalationRuleResponse {
    private UUID id;
    private TriggerCondition triggerCondition;
    private int thresholdSeconds;
    private String escalateToRole;
    private int priorityLevel;
    private List<String> notificationChannels;
    private int cooldownSeconds;
    private boolean active;
    private Instant createdAt;
    private Instant updatedAt;

    public static EscalationRuleResponse from(EscalationRule r) {
        return EscalationRuleResponse.builder()
                .id(r.getId())
                .triggerCondition(r.getTriggerCondition())
                .thresholdSeconds(r.getThresholdSeconds())
                .escalateToRole(r.getEscalateToRole())
                .priorityLevel(r.getPriorityLevel())
                .notificationChannels(r.getNotificationChannels())
                .cooldownSeconds(r.getCooldownSeconds())
                .active(r.isActive())
                .createdAt(r.getCreatedAt())
                .updatedAt(r.getUpdatedAt())
                .build();
    }
}
