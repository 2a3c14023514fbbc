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
public class SignalingMessage {
    private UUID id;
    private UUID callId;
    private UUID senderId;
    private UUID recipientId;
    private SignalKind kind;
    private String payload;
    private Instant createdAt;
    private boolean consumed;
}
