package com.flairbit.calls.service.escalation;

import com.flairbit.calls.dto.EscalationRuleRequest;
import com.flairbit.calls.exceptions.BadRequestException;
import com.flairbit.calls.exceptions.NotFoundException;
import com.flairbit.calls.exceptions.UnauthorizedException;
import com.flairbit.calls.models.CallSession;
import com.flairbit.calls.models.EscalationEvent;
import com.flairbit.calls.models.EscalationRule;
import com.flairbit.calls.models.LifecycleEventType;
import com.flairbit.calls.models.NotificationDispatch;
import com.flairbit.calls.repo.CallSessionJDBCRepository;
import com.flairbit.calls.repo.EscalationEventJDBCRepository;
import com.flairbit.calls.repo.EscalationRuleJDBCRepository;
import com.flairbit.calls.repo.NotificationDispatchJDBCRepository;
import com.flairbit.calls.security.Actor;
import com.flairbit.calls.service.CallEventPublisher;
import com.flairbit.calls.service.SessionLocks;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Responder and administrator side of escalations: acknowledgement, history and rule management.
 */
@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class EscalationService {

    private final EscalationEventJDBCRepository eventRepo;
    private final EscalationRuleJDBCRepository ruleRepo;
    private final NotificationDispatchJDBCRepository dispatchRepo;
    private final CallSessionJDBCRepository sessionRepo;
    private final NotificationChannelRegistry channelRegistry;
    private final CallEventPublisher events;
    private final SessionLocks locks;
    private final Clock clock;

    /**
     * Idempotent. The first acknowledger becomes the call's {@code escalated_to_id}; the
     * escalation itself is never retracted and the call may still connect afterwards.
     */
    public EscalationEvent acknowledge(UUID eventId, Actor actor) {
        EscalationEvent event = loadEvent(eventId);
        return locks.call(event.getCallId(), () -> {
            CallSession session = sessionRepo.findById(event.getCallId())
                    .orElseThrow(() -> new NotFoundException("Call session not found: " + event.getCallId()));
            if (!actor.isAdmin() && session.isParticipant(actor.getId())) {
                throw new UnauthorizedException("Call participants cannot acknowledge their own escalation");
            }
            Instant now = clock.instant();
            if (eventRepo.acknowledge(eventId, actor.getId(), now)) {
                sessionRepo.setEscalatedTo(event.getCallId(), actor.getId());
                events.emit(LifecycleEventType.ESCALATION_ACKNOWLEDGED, event.getCallId(), Map.of(
                        "escalationEventId", eventId.toString(),
                        "level", event.getLevel(),
                        "acknowledgedBy", actor.getId().toString()));
                log.info("Escalation {} (call {}, level {}) acknowledged by {}", eventId, event.getCallId(), event.getLevel(), actor.getId());
            }
            return loadEvent(eventId);
        });
    }

    @Transactional(readOnly = true)
    public List<EscalationEvent> listEscalations(UUID callId, Actor actor) {
        CallSession session = sessionRepo.findById(callId)
                .orElseThrow(() -> new NotFoundException("Call session not found: " + callId));
        if (!actor.isAdmin() && !session.isParticipant(actor.getId())) {
            throw new UnauthorizedException("User " + actor.getId() + " is not part of call " + callId);
        }
        return eventRepo.findByCall(callId);
    }

    @Transactional(readOnly = true)
    public List<NotificationDispatch> listDispatches(UUID eventId, Actor actor) {
        requireAdmin(actor);
        loadEvent(eventId);
        return dispatchRepo.findByEvent(eventId);
    }

    @Transactional(readOnly = true)
    public List<EscalationRule> listRules(Actor actor) {
        requireAdmin(actor);
        return ruleRepo.findAll();
    }

    public EscalationRule createRule(EscalationRuleRequest request, Actor actor) {
        requireAdmin(actor);
        validateChannels(request.getNotificationChannels());
        Instant now = clock.instant();
        EscalationRule rule = ruleRepo.insert(EscalationRule.builder()
                .id(UUID.randomUUID())
                .triggerCondition(request.getTriggerCondition())
                .thresholdSeconds(request.getThresholdSeconds())
                .escalateToRole(request.getEscalateToRole())
                .priorityLevel(request.getPriorityLevel())
                .notificationChannels(request.getNotificationChannels())
                .cooldownSeconds(request.getCooldownSeconds())
                .active(request.isActive())
                .createdAt(now)
                .updatedAt(now)
                .build());
        log.info("Escalation rule {} created by {}: {} after {}s -> {}", rule.getId(), actor.getId(),
                rule.getTriggerCondition().getValue(), rule.getThresholdSeconds(), rule.getEscalateToRole());
        return rule;
    }

    public EscalationRule updateRule(UUID ruleId, EscalationRuleRequest request, Actor actor) {
        requireAdmin(actor);
        validateChannels(request.getNotificationChannels());
        EscalationRule existing = loadRule(ruleId);
        EscalationRule updated = existing.toBuilder()
                .triggerCondition(request.getTriggerCondition())
                .thresholdSeconds(request.getThresholdSeconds())
                .escalateToRole(request.getEscalateToRole())
                .priorityLevel(request.getPriorityLevel())
                .notificationChannels(request.getNotificationChannels())
                .cooldownSeconds(request.getCooldownSeconds())
                .active(request.isActive())
                .updatedAt(clock.instant())
                .build();
        ruleRepo.update(updated);
        log.info("Escalation rule {} updated by {}", ruleId, actor.getId());
        return updated;
    }

    public EscalationRule deactivateRule(UUID ruleId, Actor actor) {
        requireAdmin(actor);
        loadRule(ruleId);
        ruleRepo.deactivate(ruleId, clock.instant());
        log.info("Escalation rule {} deactivated by {}", ruleId, actor.getId());
        return loadRule(ruleId);
    }

    private void validateChannels(List<String> channels) {
        if (channels == null || channels.isEmpty()) {
            throw new BadRequestException("At least one notification channel is required");
        }
        for (String channel : channels) {
            if (!channelRegistry.isEnabled(channel)) {
                throw new BadRequestException("Notification channel not enabled: " + channel);
            }
        }
    }

    private void requireAdmin(Actor actor) {
        if (!actor.isAdmin()) {
            throw new UnauthorizedException("Administrative capability required");
        }
    }

    private EscalationEvent loadEvent(UUID eventId) {
        return eventRepo.findById(eventId)
                .orElseThrow(() -> new NotFoundException("Escalation event not found: " + eventId));
    }

    private EscalationRule loadRule(UUID ruleId) {
        return ruleRepo.findById(ruleId)
                .orElseThrow(() -> new NotFoundException("Escalation rule not found: " + ruleId));
    }
}
