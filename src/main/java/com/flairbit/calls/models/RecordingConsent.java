package com.flairbit.calls.models;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One entry of a participant's recording consent trail. The latest entry per participant wins.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordingConsent {
    private Long entryId;
    private UUID callId;
    private UUID userId;
    private boolean given;
    private String sourceAddress;
    private Instant recordedAt;
}
