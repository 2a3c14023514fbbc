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
public class Recording {
    private UUID id;
    private UUID callId;
    private RecordingStatus status;
    private MediaFormat format;
    private UUID initiatedBy;
    private String encryptionKeyRef;
    private Instant createdAt;
    private Instant startedAt;
    private Instant stoppedAt;
    private Instant readyAt;
    private Instant retentionExpiresAt;
    private String failureReason;
    private Instant consentVerifiedAt;
    private boolean legalHold;
    private String legalHoldReason;
}
