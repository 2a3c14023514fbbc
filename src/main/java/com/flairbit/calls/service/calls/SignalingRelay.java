package com.flairbit.calls.service.calls;

import com.flairbit.calls.dto.SignalResponse;
import com.flairbit.calls.exceptions.SessionClosedException;
import com.flairbit.calls.models.CallSession;
import com.flairbit.calls.models.CallStatus;
import com.flairbit.calls.models.SignalKind;
import com.flairbit.calls.models.SignalingMessage;
import com.flairbit.calls.repo.SignalingMessageJDBCRepository;
import com.flairbit.calls.utils.AfterCommit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Durable store-and-forward channel between the two endpoints of a call.
 * <p>
 * Messages are persisted first, then pushed over STOMP to {@code /user/{recipient}/queue/signals}.
 * Endpoints without a socket long-poll through {@link #poll}; a waiting poll is woken when a message
 * for its recipient is stored and is failed with {@link SessionClosedException} when the call ends.
 * Delivery is at-least-once.
 */
@Slf4j
@Component
public class SignalingRelay implements CallLifecycleListener {

    static final String SIGNAL_QUEUE = "/queue/signals";

    private final SignalingMessageJDBCRepository messageRepo;
    private final SimpMessagingTemplate messaging;
    private final Clock clock;

    private final Executor drainExecutor;

    private final Map<UUID, Map<UUID, Set<CompletableFuture<Void>>>> waiters = new ConcurrentHashMap<>();

    public SignalingRelay(SignalingMessageJDBCRepository messageRepo,
                          SimpMessagingTemplate messaging,
                          @Qualifier("signalDrainExecutor") Executor drainExecutor,
                          Clock clock) {
        this.messageRepo = messageRepo;
        this.messaging = messaging;
        this.drainExecutor = drainExecutor;
        this.clock = clock;
    }

    public SignalingMessage append(CallSession session, UUID senderId, SignalKind kind, String payload) {
        SignalingMessage message = messageRepo.insert(SignalingMessage.builder()
                .id(UUID.randomUUID())
                .callId(session.getId())
                .senderId(senderId)
                .recipientId(session.otherParticipant(senderId))
                .kind(kind)
                .payload(payload)
                .createdAt(clock.instant())
                .consumed(false)
                .build());

        AfterCommit.run(() -> {
            push(message);
            wake(message.getCallId(), message.getRecipientId());
        });
        return message;
    }

    public CompletableFuture<List<SignalingMessage>> poll(UUID callId, UUID recipientId, Duration wait) {
        List<SignalingMessage> pending = drain(callId, recipientId);
        if (!pending.isEmpty() || wait == null || wait.isZero() || wait.isNegative()) {
            return CompletableFuture.completedFuture(pending);
        }

        CompletableFuture<Void> wake = new CompletableFuture<>();
        Set<CompletableFuture<Void>> recipientWaiters = waiters
                .computeIfAbsent(callId, id -> new ConcurrentHashMap<>())
                .computeIfAbsent(recipientId, id -> ConcurrentHashMap.newKeySet());
        recipientWaiters.add(wake);
        wake.whenComplete((v, ex) -> recipientWaiters.remove(wake));
        wake.completeOnTimeout(null, wait.toMillis(), TimeUnit.MILLISECONDS);

        // a message stored between the first drain and registration would otherwise wait out the timeout
        if (!messageRepo.findPending(callId, recipientId).isEmpty()) {
            wake.complete(null);
        }
        return wake.thenApplyAsync(v -> drain(callId, recipientId), drainExecutor);
    }

    public List<SignalingMessage> history(UUID callId) {
        return messageRepo.findByCall(callId);
    }

    public int waitingPolls(UUID callId) {
        Map<UUID, Set<CompletableFuture<Void>>> byRecipient = waiters.get(callId);
        return byRecipient == null ? 0 : byRecipient.values().stream().mapToInt(Set::size).sum();
    }

    @Override
    public void onTransition(CallSession session, CallStatus from, CallStatus to) {
        if (!to.isTerminal()) return;
        AfterCommit.run(() -> cancelWaiters(session.getId(), to));
    }

    private void cancelWaiters(UUID callId, CallStatus terminal) {
        Map<UUID, Set<CompletableFuture<Void>>> byRecipient = waiters.remove(callId);
        if (byRecipient == null) return;
        SessionClosedException closed = new SessionClosedException("Call " + callId + " is " + terminal.getValue());
        byRecipient.values().forEach(set -> set.forEach(f -> f.completeExceptionally(closed)));
        log.debug("Cancelled signaling waits for call {}", callId);
    }

    private void wake(UUID callId, UUID recipientId) {
        Map<UUID, Set<CompletableFuture<Void>>> byRecipient = waiters.get(callId);
        if (byRecipient == null) return;
        Set<CompletableFuture<Void>> set = byRecipient.get(recipientId);
        if (set != null) {
            set.forEach(f -> f.complete(null));
        }
    }

    private List<SignalingMessage> drain(UUID callId, UUID recipientId) {
        List<SignalingMessage> pending = messageRepo.findPending(callId, recipientId);
        messageRepo.markConsumed(pending, clock.instant());
        return pending;
    }

    private void push(SignalingMessage message) {
        try {
            messaging.convertAndSendToUser(message.getRecipientId().toString(), SIGNAL_QUEUE, SignalResponse.from(message));
        } catch (MessagingException e) {
            // the message stays unconsumed and is picked up by the next poll
            log.warn("Signal push to {} failed for call {}: {}", message.getRecipientId(), message.getCallId(), e.getMessage());
        }
    }

    public int purgeEndedBefore(Instant cutoff) {
        return messageRepo.deleteForCallsEndedBefore(cutoff);
    }

}
