package com.flairbit.calls.service.escalation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flairbit.calls.dto.EscalationNotification;
import com.flairbit.calls.models.CallSession;
import com.flairbit.calls.models.CallStatus;
import com.flairbit.calls.models.EscalationEvent;
import com.flairbit.calls.models.EscalationRule;
import com.flairbit.calls.models.LifecycleEventType;
import com.flairbit.calls.models.NotificationDispatch;
import com.flairbit.calls.models.DispatchStatus;
import com.flairbit.calls.repo.CallSessionJDBCRepository;
import com.flairbit.calls.repo.EscalationEventJDBCRepository;
import com.flairbit.calls.repo.EscalationRuleJDBCRepository;
import com.flairbit.calls.repo.NotificationDispatchJDBCRepository;
import com.flairbit.calls.service.CallEventPublisher;
import com.flairbit.calls.service.CallSettingsService;
import com.flairbit.calls.service.SessionLocks;
import com.flairbit.calls.service.calls.CallSessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Periodic evaluator of escalation rules.
 * <p>
 * Holds no state between ticks: every decision is re-derived from persisted sessions, rules and
 * events, so a restart simply re-evaluates. This is the only writer of
 * {@code call_sessions.escalation_level}. The unique (call_id, event_level) constraint settles
 * races between nodes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EscalationEngine {

    private final CallSessionJDBCRepository sessionRepo;
    private final EscalationRuleJDBCRepository ruleRepo;
    private final EscalationEventJDBCRepository eventRepo;
    private final NotificationDispatchJDBCRepository dispatchRepo;
    private final CallSessionService callSessionService;
    private final CallEventPublisher events;
    private final CallSettingsService settings;
    private final SessionLocks locks;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper json;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * @return number of escalations raised, or -1 when the previous tick was still running
     */
    public int tick() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Previous escalation tick still running, skipping");
            return -1;
        }
        try {
            return evaluate(clock.instant());
        } finally {
            running.set(false);
        }
    }

    private int evaluate(Instant now) {
        List<EscalationRule> rules = ruleRepo.findActive();
        int raised = 0;
        if (!rules.isEmpty()) {
            for (CallSession session : sessionRepo.findActive()) {
                try {
                    if (evaluateSession(session, rules, now)) raised++;
                } catch (RuntimeException e) {
                    log.error("Escalation evaluation failed for call {}: {}", session.getId(), e.getMessage(), e);
                }
            }
        }

        Instant ringCutoff = now.minus(settings.ringTimeout());
        for (CallSession ringing : sessionRepo.findRingingSince(ringCutoff)) {
            if (callSessionService.markMissed(ringing.getId())) {
                log.info("Call {} missed after ringing since {}", ringing.getId(), ringing.getRingingAt());
            }
        }
        callSessionService.expireIdleSessions();

        if (raised > 0) {
            log.info("Escalation tick raised {} escalations", raised);
        }
        return raised;
    }

    private boolean evaluateSession(CallSession session, List<EscalationRule> rules, Instant now) {
        List<EscalationEvent> history = eventRepo.findByCall(session.getId());
        Set<UUID> firedRules = history.stream().map(EscalationEvent::getRuleId).collect(Collectors.toSet());
        Instant lastTriggered = history.stream()
                .map(EscalationEvent::getTriggeredAt)
                .max(Comparator.naturalOrder())
                .orElse(null);

        for (EscalationRule rule : rules) {
            if (firedRules.contains(rule.getId())) continue;
            if (lastTriggered != null && lastTriggered.plusSeconds(rule.getCooldownSeconds()).isAfter(now)) continue;
            if (!matches(rule, session, now)) continue;
            // one escalation per call per tick
            return raise(session.getId(), rule, now);
        }
        return false;
    }

    static boolean matches(EscalationRule rule, CallSession session, Instant now) {
        long threshold = rule.getThresholdSeconds();
        return switch (rule.getTriggerCondition()) {
            case UNANSWERED_TIMEOUT -> (session.getStatus() == CallStatus.INITIATED || session.getStatus() == CallStatus.RINGING)
                    && session.getCreatedAt().plusSeconds(threshold).isBefore(now);
            case FLAGGED -> session.isFlagged()
                    && session.getFlaggedAt().plusSeconds(threshold).isBefore(now);
            case ENDPOINT_OFFLINE -> session.getStatus() == CallStatus.CONNECTED
                    && oldestHeartbeat(session).plusSeconds(threshold).isBefore(now);
        };
    }

    private static Instant oldestHeartbeat(CallSession session) {
        Instant fallback = session.getAnsweredAt() != null ? session.getAnsweredAt() : session.getCreatedAt();
        return Stream.of(session.getInitiatorLastSeenAt(), session.getCounterpartLastSeenAt())
                .map(seen -> seen == null ? fallback : seen)
                .min(Comparator.naturalOrder())
                .orElse(fallback);
    }

    private boolean raise(UUID callId, EscalationRule rule, Instant now) {
        return locks.call(callId, () -> {
            CallSession current = sessionRepo.findById(callId).orElse(null);
            if (current == null || current.getStatus().isTerminal() || !matches(rule, current, now)) {
                return false;
            }
            int level = current.getEscalationLevel() + 1;
            if (eventRepo.existsAtOrAbove(callId, level)) {
                log.warn("Call {} already has an escalation at level >= {}", callId, level);
                return false;
            }

            EscalationEvent event = EscalationEvent.builder()
                    .id(UUID.randomUUID())
                    .callId(callId)
                    .ruleId(rule.getId())
                    .level(level)
                    .triggeredAt(now)
                    .build();
            try {
                // the event and its dispatches commit together, before any delivery is attempted
                transactionTemplate.executeWithoutResult(status -> {
                    eventRepo.insert(event);
                    sessionRepo.raiseEscalationLevel(callId, level);
                    dispatchRepo.saveAll(dispatches(event, rule, current, now));
                    events.emit(LifecycleEventType.ESCALATION_RAISED, callId, eventData(event, rule));
                });
            } catch (DuplicateKeyException e) {
                log.info("Escalation of call {} to level {} already recorded elsewhere", callId, level);
                return false;
            }
            log.warn("Call {} escalated to level {} by rule {} ({} -> {})",
                    callId, level, rule.getId(), rule.getTriggerCondition().getValue(), rule.getEscalateToRole());
            return true;
        });
    }

    private List<NotificationDispatch> dispatches(EscalationEvent event, EscalationRule rule, CallSession session, Instant now) {
        String payload = payload(EscalationNotification.builder()
                .escalationEventId(event.getId())
                .callId(session.getId())
                .level(event.getLevel())
                .trigger(rule.getTriggerCondition().getValue())
                .escalateToRole(rule.getEscalateToRole())
                .callType(session.getCallType().getValue())
                .callStatus(session.getStatus().getValue())
                .context(session.getContext())
                .triggeredAt(event.getTriggeredAt())
                .build());

        return rule.getNotificationChannels().stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(channel -> !channel.isEmpty())
                .distinct()
                .map(channel -> NotificationDispatch.builder()
                        .id(UUID.randomUUID())
                        .escalationEventId(event.getId())
                        .channel(channel)
                        .recipientRole(rule.getEscalateToRole())
                        .payload(payload)
                        .status(DispatchStatus.PENDING)
                        .attempts(0)
                        .nextAttemptAt(now)
                        .createdAt(now)
                        .build())
                .toList();
    }

    private Map<String, Object> eventData(EscalationEvent event, EscalationRule rule) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("escalationEventId", event.getId().toString());
        data.put("ruleId", rule.getId().toString());
        data.put("level", event.getLevel());
        data.put("trigger", rule.getTriggerCondition().getValue());
        data.put("escalateToRole", rule.getEscalateToRole());
        return data;
    }

    private String payload(EscalationNotification notification) {
        try {
            return json.writeValueAsString(notification);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize escalation notification", e);
        }
    }
}
