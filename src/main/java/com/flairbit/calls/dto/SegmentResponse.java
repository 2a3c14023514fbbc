package com.flairbit.calls.dto;

import com.flairbit.calls.models.RecordingSegment;
import com.flairbit.calls.models.SegmentUploadStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SegmentResponse {
    private int sequenceNumber;
    private long startOffsetMs;
    private Long endOffsetMs;
    private Long durationMs;
    private String checksum;
    private Long sizeBytes;
    private SegmentUploadStatus uploadStatus;
    private int attempts;
    private Instant uploadedAt;

    public static SegmentResponse from(RecordingSegment s) {
        return SegmentResponse.builder()
                .sequenceNumber(s.getSequenceNumber())
                .startOffsetMs(s.getStartOffsetMs())
                .endOffsetMs(s.getEndOffsetMs())
                .durationMs(s.getDurationMs())
                .checksum(s.getChecksum())
                .sizeBytes(s.getSizeBytes())
                .uploadStatus(s.getUploadStatus())
                .attempts(s.getAttempts())
                .uploadedAt(s.getUploadedAt())
                .build();
    }
}
