package com.flairbit.calls.service.calls;

import com.flairbit.calls.config.CallsProperties;
import com.flairbit.calls.exceptions.InvalidParticipantsException;
import com.flairbit.calls.exceptions.NotFoundException;
import com.flairbit.calls.exceptions.RateLimitException;
import com.flairbit.calls.exceptions.SessionClosedException;
import com.flairbit.calls.exceptions.UnauthorizedException;
import com.flairbit.calls.models.CallSession;
import com.flairbit.calls.models.CallStatus;
import com.flairbit.calls.models.CallType;
import com.flairbit.calls.models.LifecycleEventType;
import com.flairbit.calls.models.MediaFormat;
import com.flairbit.calls.models.SignalKind;
import com.flairbit.calls.models.SignalingMessage;
import com.flairbit.calls.repo.CallSessionJDBCRepository;
import com.flairbit.calls.security.Actor;
import com.flairbit.calls.security.RateLimiter;
import com.flairbit.calls.service.CallEventPublisher;
import com.flairbit.calls.service.CallSettingsService;
import com.flairbit.calls.service.ParticipantService;
import com.flairbit.calls.service.SessionLocks;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class CallSessionServiceImp implements CallSessionService {

    public static final String REASON_HANGUP = "hangup";
    public static final String REASON_RING_TIMEOUT = "ring_timeout";
    public static final String REASON_SIGNALING_IDLE = "signaling_idle";
    public static final String REASON_MONITOR_DROP = "dropped_by_monitor";

    private final CallSessionJDBCRepository sessionRepo;
    private final SignalingRelay relay;
    private final ParticipantService participantService;
    private final CallEventPublisher events;
    private final CallSettingsService settings;
    private final CallsProperties properties;
    private final SessionLocks locks;
    private final List<CallLifecycleListener> listeners;
    private final Clock clock;

    @Override
    public CallSession create(UUID initiatorId, UUID counterpartId, CallType type, MediaFormat mode, String context) {
        if (Objects.isNull(initiatorId) || Objects.isNull(counterpartId)) {
            throw new InvalidParticipantsException("Both initiator and counterpart are required");
        }
        if (initiatorId.equals(counterpartId)) {
            throw new InvalidParticipantsException("A call needs two distinct participants");
        }
        if (!participantService.exists(initiatorId)) {
            throw new InvalidParticipantsException("Unknown initiator: " + initiatorId);
        }
        if (!participantService.exists(counterpartId)) {
            throw new InvalidParticipantsException("Unknown counterpart: " + counterpartId);
        }

        return locks.call(initiatorId, () -> {
            if (sessionRepo.hasActiveSession(initiatorId)) {
                throw new InvalidParticipantsException("Initiator " + initiatorId + " already has an active call");
            }
            Instant now = clock.instant();
            CallSession session = insertGuarded(CallSession.builder()
                    .id(UUID.randomUUID())
                    .initiatorId(initiatorId)
                    .counterpartId(counterpartId)
                    .status(CallStatus.INITIATED)
                    .escalationLevel(0)
                    .callType(type == null ? CallType.SCHEDULED : type)
                    .mode(mode == null ? MediaFormat.AUDIO : mode)
                    .context(context)
                    .createdAt(now)
                    .lastSignalAt(now)
                    .initiatorLastSeenAt(now)
                    .build());
            log.info("Call {} created: {} -> {} ({})", session.getId(), initiatorId, counterpartId, session.getCallType().getValue());
            return session;
        });
    }

    /**
     * The lock only covers this node; the unique active-initiator column settles a create that
     * raced on another node.
     */
    private CallSession insertGuarded(CallSession session) {
        try {
            return sessionRepo.insert(session);
        } catch (DuplicateKeyException e) {
            throw new InvalidParticipantsException("Initiator " + session.getInitiatorId() + " already has an active call");
        }
    }

    @Override
    public SignalingMessage relaySignal(UUID callId, UUID senderId, SignalKind kind, String payload) {
        return locks.call(callId, () -> {
            CallSession session = load(callId);
            requireOpen(session);
            if (!session.isParticipant(senderId)) {
                throw new UnauthorizedException("User " + senderId + " is not part of call " + callId);
            }
            if (!RateLimiter.allow(senderId, properties.getSignaling().getMaxMessagesPerMinute())) {
                throw new RateLimitException("Too many signaling messages from " + senderId);
            }

            Instant now = clock.instant();
            SignalingMessage message = relay.append(session, senderId, kind, payload);
            sessionRepo.touch(callId, session.getInitiatorId().equals(senderId), now);
            applySignal(session, senderId, kind, now);
            return message;
        });
    }

    /**
     * Offer and answer drive the first transitions only. Anything arriving after the session
     * moved on is relayed but changes nothing.
     */
    private void applySignal(CallSession session, UUID senderId, SignalKind kind, Instant now) {
        switch (kind) {
            case OFFER -> {
                if (session.getStatus() == CallStatus.INITIATED) {
                    transition(session, CallStatus.RINGING, now, null);
                } else {
                    log.debug("Stale offer on call {} in state {}", session.getId(), session.getStatus().getValue());
                }
            }
            case ANSWER -> {
                if (!session.getCounterpartId().equals(senderId)) {
                    log.debug("Ignoring answer from initiator on call {}", session.getId());
                    return;
                }
                CallSession current = session;
                if (current.getStatus() == CallStatus.INITIATED && transition(current, CallStatus.RINGING, now, null)) {
                    // answer overtook the offer
                    current = load(session.getId());
                }
                if (current.getStatus() == CallStatus.RINGING) {
                    transition(current, CallStatus.CONNECTED, now, null);
                } else {
                    log.debug("Stale answer on call {} in state {}", session.getId(), current.getStatus().getValue());
                }
            }
            case HANGUP -> terminate(session, REASON_HANGUP, now);
            case ICE_CANDIDATE -> {
            }
        }
    }

    @Override
    public CompletableFuture<List<SignalingMessage>> pollSignals(UUID callId, UUID recipientId, Duration wait) {
        CallSession session = load(callId);
        if (!session.isParticipant(recipientId)) {
            throw new UnauthorizedException("User " + recipientId + " is not part of call " + callId);
        }
        Duration max = properties.getSignaling().getMaxPollWait();
        Duration effective = wait == null || wait.compareTo(max) > 0 ? max : wait;

        if (session.getStatus().isTerminal()) {
            // the final hangup is still delivered, after that the channel is closed
            List<SignalingMessage> remaining = relay.poll(callId, recipientId, Duration.ZERO).join();
            if (remaining.isEmpty()) {
                throw new SessionClosedException("Call " + callId + " is " + session.getStatus().getValue());
            }
            return CompletableFuture.completedFuture(remaining);
        }
        return relay.poll(callId, recipientId, effective);
    }

    @Override
    public void heartbeat(UUID callId, UUID participantId) {
        locks.run(callId, () -> {
            CallSession session = load(callId);
            requireOpen(session);
            if (!session.isParticipant(participantId)) {
                throw new UnauthorizedException("User " + participantId + " is not part of call " + callId);
            }
            sessionRepo.touch(callId, session.getInitiatorId().equals(participantId), clock.instant());
        });
    }

    @Override
    public CallSession end(UUID callId, String reason) {
        return locks.call(callId, () -> {
            CallSession session = load(callId);
            if (session.getStatus().isTerminal()) {
                return session;
            }
            terminate(session, reason == null ? REASON_HANGUP : reason, clock.instant());
            return load(callId);
        });
    }

    @Override
    public CallSession end(UUID callId, Actor actor, String reason) {
        CallSession session = load(callId);
        if (!actor.isAdmin() && !session.isParticipant(actor.getId())) {
            throw new UnauthorizedException("User " + actor.getId() + " is not part of call " + callId);
        }
        return end(callId, reason);
    }

    @Override
    public boolean markMissed(UUID callId) {
        return locks.call(callId, () -> {
            CallSession session = load(callId);
            if (session.getStatus() != CallStatus.RINGING) {
                return false;
            }
            return transition(session, CallStatus.MISSED, clock.instant(), REASON_RING_TIMEOUT);
        });
    }

    @Override
    public boolean fail(UUID callId, String reason) {
        return locks.call(callId, () -> {
            CallSession session = load(callId);
            if (session.getStatus().isTerminal()) {
                return false;
            }
            return transition(session, CallStatus.FAILED, clock.instant(), reason);
        });
    }

    @Override
    public int expireIdleSessions() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(settings.signalingIdleTimeout());
        int expired = 0;
        for (CallSession candidate : sessionRepo.findIdleSince(cutoff)) {
            boolean failed = locks.call(candidate.getId(), () -> {
                CallSession session = load(candidate.getId());
                if (session.getStatus().isTerminal() || !session.lastActivityAt().isBefore(cutoff)) {
                    return false;
                }
                return transition(session, CallStatus.FAILED, now, REASON_SIGNALING_IDLE);
            });
            if (failed) expired++;
        }
        if (expired > 0) {
            log.info("Expired {} idle call sessions", expired);
        }
        return expired;
    }

    @Override
    public CallSession flag(UUID callId, Actor actor, String reason) {
        return locks.call(callId, () -> {
            CallSession session = load(callId);
            requireOpen(session);
            if (!actor.isAdmin() && !session.isParticipant(actor.getId())) {
                throw new UnauthorizedException("User " + actor.getId() + " cannot flag call " + callId);
            }
            Instant now = clock.instant();
            if (sessionRepo.markFlagged(callId, actor.getId(), reason, now)) {
                Map<String, Object> data = new LinkedHashMap<>();
                data.put("flaggedBy", actor.getId().toString());
                data.put("reason", reason == null ? "" : reason);
                events.emit(LifecycleEventType.CALL_FLAGGED, callId, data);
                log.warn("Call {} flagged urgent by {}: {}", callId, actor.getId(), reason);
            }
            return load(callId);
        });
    }

    @Override
    public CallSession monitorDrop(UUID callId, Actor actor, String reason) {
        if (!actor.isAdmin()) {
            throw new UnauthorizedException("Only monitors can drop calls");
        }
        return locks.call(callId, () -> {
            CallSession session = load(callId);
            if (session.getStatus().isTerminal()) {
                return session;
            }
            log.warn("Call {} dropped by monitor {}: {}", callId, actor.getId(), reason);
            terminate(session, REASON_MONITOR_DROP, clock.instant());
            return load(callId);
        });
    }

    @Override
    @Transactional(readOnly = true)
    public CallSession getCallStatus(UUID callId) {
        return load(callId);
    }

    @Override
    @Transactional(readOnly = true)
    public CallSession getCallStatus(UUID callId, Actor actor) {
        CallSession session = load(callId);
        if (!actor.isAdmin() && !session.isParticipant(actor.getId())) {
            throw new UnauthorizedException("User " + actor.getId() + " is not part of call " + callId);
        }
        return session;
    }

    @Override
    @Transactional(readOnly = true)
    public List<CallSession> listCalls(UUID userId, int limit) {
        return sessionRepo.findByParticipant(userId, Math.max(1, Math.min(limit, 200)));
    }

    /**
     * Ends an open session. Only a connected call can end normally; one that never connected
     * is missed when it was ringing and failed when it never rang.
     */
    private void terminate(CallSession session, String reason, Instant now) {
        CallStatus terminal = switch (session.getStatus()) {
            case CONNECTED -> CallStatus.ENDED;
            case RINGING -> CallStatus.MISSED;
            default -> CallStatus.FAILED;
        };
        transition(session, terminal, now, reason);
    }

    private boolean transition(CallSession session, CallStatus to, Instant at, String reason) {
        CallStatus from = session.getStatus();
        if (!from.canTransitionTo(to)) {
            log.debug("Ignoring {} -> {} on call {}", from.getValue(), to.getValue(), session.getId());
            return false;
        }
        boolean applied = switch (to) {
            case RINGING -> sessionRepo.markRinging(session.getId(), at);
            case CONNECTED -> sessionRepo.markConnected(session.getId(), at);
            case ENDED, MISSED, FAILED -> sessionRepo.markTerminal(session.getId(), from, to, at, reason);
            case INITIATED -> false;
        };
        if (!applied) {
            log.debug("Call {} left {} concurrently, {} not applied", session.getId(), from.getValue(), to.getValue());
            return false;
        }

        CallSession updated = load(session.getId());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("from", from.getValue());
        data.put("to", to.getValue());
        if (reason != null) data.put("reason", reason);
        data.put("escalationLevel", updated.getEscalationLevel());
        events.emit(LifecycleEventType.forCallStatus(to), session.getId(), data);
        log.info("Call {} {} -> {}{}", session.getId(), from.getValue(), to.getValue(), reason == null ? "" : " (" + reason + ")");

        for (CallLifecycleListener listener : listeners) {
            try {
                listener.onTransition(updated, from, to);
            } catch (RuntimeException e) {
                log.error("Lifecycle listener {} failed for call {}: {}",
                        listener.getClass().getSimpleName(), session.getId(), e.getMessage(), e);
            }
        }
        return true;
    }

    private void requireOpen(CallSession session) {
        if (session.getStatus().isTerminal()) {
            throw new SessionClosedException("Call " + session.getId() + " is " + session.getStatus().getValue());
        }
    }

    private CallSession load(UUID callId) {
        return sessionRepo.findById(callId)
                .orElseThrow(() -> new NotFoundException("Call session not found: " + callId));
    }
}
