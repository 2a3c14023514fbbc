package com.flairbit.calls.dto;

import com.flairbit.calls.models.TriggerCondition;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscalationRuleRequest {
    @NotNull
    private TriggerCondition triggerCondition;
    @Min(0)
    private int thresholdSeconds;
    @NotBlank
    private String escalateToRole;
    private int priorityLevel;
    @NotEmpty
    private List<String> notificationChannels;
    @Min(0)
    private int cooldownSeconds;
    @Builder.Default
    private boolean active = true;
}
