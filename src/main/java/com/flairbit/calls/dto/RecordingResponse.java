package com.flairbit.calls.dto;

import com.flairbit.calls.models.MediaFormat;
import com.flairbit.calls.models.Recording;
import com.flairbit.calls.models.RecordingStatus;
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
public class RecordingResponse {
    private UUID id;
    private UUID callId;
    private RecordingStatus status;
    private MediaFormat format;
    private UUID initiatedBy;
    private Instant createdAt;
    private Instant startedAt;
    private Instant stoppedAt;
    private Instant readyAt;
    private Instant retentionExpiresAt;
    private String failureReason;
    private Instant consentVerifiedAt;
    private boolean legalHold;
    private String legalHoldReason;

    public static RecordingResponse from(Recording r) {
        return RecordingResponse.builder()
                .id(r.getId())
                .callId(r.getCallId())
                .status(r.getStatus())
                .format(r.getFormat())
                .initiatedBy(r.getInitiatedBy())
                .createdAt(r.getCreatedAt())
                .startedAt(r.getStartedAt())
                .stoppedAt(r.getStoppedAt())
                .readyAt(r.getReadyAt())
                .retentionExpiresAt(r.getRetentionExpiresAt())
                .failureReason(r.getFailureReason())
                .consentVerifiedAt(r.getConsentVerifiedAt())
                .legalHold(r.isLegalHold())
                .legalHoldReason(r.getLegalHoldReason())
                .build();
    }
}
