package com.flairbit.calls.models;

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
public class AccessLogEntry {
    private UUID id;
    private UUID recordingId;
    private UUID accessorId;
    private AccessAction action;
    private boolean allowed;
    private String reason;
    private String sourceAddress;
    private Instant timestamp;
}
