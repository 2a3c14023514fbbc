package com.flairbit.calls.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class EscalationRule {
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
}
