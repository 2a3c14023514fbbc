package com.flairbit.calls.dto;

import com.flairbit.calls.models.DispatchStatus;
import com.flairbit.calls.models.NotificationDispatch;
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
public class NotificationDispatchResponse {
    private UUID id;
    private UUID escalationEventId;
    private String channel;
    private String recipientRole;
    private DispatchStatus status;
    private int attempts;
    private Instant nextAttemptAt;
    private String lastError;
    private Instant createdAt;
    private Instant sentAt;

    public static NotificationDispatchResponse from(NotificationDispatch d) {
        return NotificationDispatchResponse.builder()
                .id(d.getId())
                .escalationEventId(d.getEscalationEventId())
                .channel(d.getChannel())
                .recipientRole(d.getRecipientRole())
                .status(d.getStatus())
                .attempts(d.getAttempts())
                .nextAttemptAt(d.getNextAttemptAt())
                .lastError(d.getLastError())
                .createdAt(d.getCreatedAt())
                .sentAt(d.getSentAt())
                .build();
    }
}
