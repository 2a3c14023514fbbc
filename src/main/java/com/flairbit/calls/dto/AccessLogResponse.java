package com.flairbit.calls.dto;

import com.flairbit.calls.models.AccessAction;
import com.flairbit.calls.models.AccessLogEntry;
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
public class AccessLogResponse {
    private UUID id;
    private UUID recordingId;
    private UUID accessorId;
    private AccessAction action;
    private boolean allowed;
    private String reason;
    private String sourceAddress;
    private Instant timestamp;

    public static AccessLogResponse from(AccessLogEntry e) {
        return AccessLogResponse.builder()
                .id(e.getId())
                .recordingId(e.getRecordingId())
                .accessorId(e.getAccessorId())
                .action(e.getAction())
                .allowed(e.isAllowed())
                .reason(e.getReason())
                .sourceAddress(e.getSourceAddress())
                .timestamp(e.getTimestamp())
                .build();
    }
}
