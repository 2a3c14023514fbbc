package com.flairbit.calls.service.calls;

import com.flairbit.calls.models.CallSession;
import com.flairbit.calls.models.CallType;
import com.flairbit.calls.models.MediaFormat;
import com.flairbit.calls.models.SignalKind;
import com.flairbit.calls.models.SignalingMessage;
import com.flairbit.calls.security.Actor;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

public interface CallSessionService {

    CallSession create(UUID initiatorId, UUID counterpartId, CallType type, MediaFormat mode, String context);

    SignalingMessage relaySignal(UUID callId, UUID senderId, SignalKind kind, String payload);

    CompletableFuture<List<SignalingMessage>> pollSignals(UUID callId, UUID recipientId, Duration wait);

    void heartbeat(UUID callId, UUID participantId);

    CallSession end(UUID callId, String reason);

    CallSession end(UUID callId, Actor actor, String reason);

    boolean markMissed(UUID callId);

    boolean fail(UUID callId, String reason);

    int expireIdleSessions();

    CallSession flag(UUID callId, Actor actor, String reason);

    CallSession monitorDrop(UUID callId, Actor actor, String reason);

    CallSession getCallStatus(UUID callId);

    CallSession getCallStatus(UUID callId, Actor actor);

    List<CallSession> listCalls(UUID userId, int limit);
}
