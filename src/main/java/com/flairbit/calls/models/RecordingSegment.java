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
public class RecordingSegment {
    private UUID recordingId;
    private int sequenceNumber;
    /** Milliseconds since the recording started. */
    private long startOffsetMs;
    private Long endOffsetMs;
    private Long durationMs;
    private String storagePath;
    private String checksum;
    private Long sizeBytes;
    private SegmentUploadStatus uploadStatus;
    private int attempts;
    private Instant uploadedAt;
}
