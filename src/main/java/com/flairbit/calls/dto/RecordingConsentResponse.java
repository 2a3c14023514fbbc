package com.flairbit.calls.dto;

import com.flairbit.calls.models.RecordingConsent;
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
public class RecordingConsentResponse {
    private UUID callId;
    private UUID userId;
    private boolean given;
    private Instant recordedAt;

    public static RecordingConsentResponse from(RecordingConsent c) {
        return RecordingConsentResponse.builder()
                .callId(c.getCallId())
                .userId(c.getUserId())
                .given(c.isGiven())
                .recordedAt(c.getRecordedAt())
                .build();
    }
}
