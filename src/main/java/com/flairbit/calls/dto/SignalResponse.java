package com.flairbit.calls.dto;

import com.flairbit.calls.models.SignalKind;
import com.flairbit.calls.models.SignalingMessage;
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
public class SignalResponse {
    private UUID id;
    private UUID callId;
    private UUID senderId;
    private UUID recipientId;
    private SignalKind kind;
    private String payload;
    private Instant createdAt;

    public static SignalResponse from(SignalingMessage m) {
        return SignalResponse.builder()
                .id(m.getId())
                .callId(m.getCallId())
                .senderId(m.getSenderId())
                .recipientId(m.getRecipientId())
                .kind(m.getKind())
                .payload(m.getPayload())
                .createdAt(m.getCreatedAt())
                .build();
    }
}
