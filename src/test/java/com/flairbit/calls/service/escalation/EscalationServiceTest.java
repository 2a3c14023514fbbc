package com.flairbit.calls.service.escalation;

import com.flairbit.calls.dto.EscalationRuleRequest;
import com.flairbit.calls.exceptions.BadRequestException;
import com.flairbit.calls.exceptions.UnauthorizedException;
import com.flairbit.calls.models.CallSession;
import com.flairbit.calls.models.EscalationEvent;
import com.flairbit.calls.models.EscalationRule;
import com.flairbit.calls.models.TriggerCondition;
import com.flairbit.calls.security.Actor;
import com.flairbit.calls.support.CallsFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EscalationServiceTest {

    private CallsFixture f;
    private EscalationService service;
    private final Actor admin = Actor.admin(UUID.randomUUID());
    private final Actor supervisor = Actor.user(UUID.randomUUID());

    @BeforeEach
    void setUp() {
        f = new CallsFixture();
        NotificationChannelRegistry registry = new NotificationChannelRegistry(
                List.of(new StompNotificationChannel(f.messaging)), f.properties);
        service = new EscalationService(f.eventRepo, f.ruleRepo, f.dispatchRepo, f.sessionRepo, registry,
                f.events, f.locks, f.clock);
    }

    @AfterEach
    void tearDown() {
        f.close();
    }

    private EscalationRuleRequest request(int threshold) {
        return EscalationRuleRequest.builder()
                .triggerCondition(TriggerCondition.UNANSWERED_TIMEOUT)
                .thresholdSeconds(threshold)
                .escalateToRole("supervisor")
                .priorityLevel(1)
                .notificationChannels(List.of("stomp"))
                .cooldownSeconds(0)
                .build();
    }

    private EscalationEvent escalate(CallSession session) {
        EscalationRule rule = service.createRule(request(30), admin);
        EscalationEvent event = EscalationEvent.builder()
                .id(UUID.randomUUID())
                .callId(session.getId())
                .ruleId(rule.getId())
                .level(1)
                .triggeredAt(f.clock.instant())
                .build();
        f.eventRepo.insert(event);
        f.sessionRepo.raiseEscalationLevel(session.getId(), 1);
        return event;
    }

    @Test
    void rulesAreAdminManaged() {
        assertThatThrownBy(() -> service.createRule(request(30), supervisor)).isInstanceOf(UnauthorizedException.class);

        EscalationRule created = service.createRule(request(30), admin);
        assertThat(created.isActive()).isTrue();

        EscalationRule updated = service.updateRule(created.getId(), request(45), admin);
        assertThat(updated.getThresholdSeconds()).isEqualTo(45);

        EscalationRule deactivated = service.deactivateRule(created.getId(), admin);
        assertThat(deactivated.isActive()).isFalse();
        assertThat(f.ruleRepo.findActive()).isEmpty();
        assertThat(service.listRules(admin)).hasSize(1);
    }

    @Test
    void rulesMustUseEnabledChannels() {
        EscalationRuleRequest sms = request(30);
        sms.setNotificationChannels(List.of("stomp", "sms"));

        assertThatThrownBy(() -> service.createRule(sms, admin))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("sms");
    }

    @Test
    void acknowledgementAssignsCallOnce() {
        CallSession session = f.newCall();
        EscalationEvent event = escalate(session);

        EscalationEvent acked = service.acknowledge(event.getId(), supervisor);
        f.clock.advanceSeconds(5);
        EscalationEvent again = service.acknowledge(event.getId(), Actor.admin(UUID.randomUUID()));

        assertThat(acked.getAcknowledgedBy()).isEqualTo(supervisor.getId());
        assertThat(again.getAcknowledgedBy()).isEqualTo(supervisor.getId());
        assertThat(again.getAcknowledgedAt()).isEqualTo(CallsFixture.T0);
        assertThat(f.sessionRepo.findById(session.getId()).orElseThrow().getEscalatedToId()).isEqualTo(supervisor.getId());
        assertThat(f.eventTypes(session.getId())).filteredOn("escalation.acknowledged"::equals).hasSize(1);
    }

    @Test
    void participantsCannotAcknowledgeTheirOwnEscalation() {
        CallSession session = f.newCall();
        EscalationEvent event = escalate(session);

        assertThatThrownBy(() -> service.acknowledge(event.getId(), Actor.user(f.alice)))
                .isInstanceOf(UnauthorizedException.class);
    }

    @Test
    void escalationHistoryIsVisibleToParticipantsAndAdmins() {
        CallSession session = f.newCall();
        escalate(session);

        assertThat(service.listEscalations(session.getId(), Actor.user(f.bob))).hasSize(1);
        assertThat(service.listEscalations(session.getId(), admin)).hasSize(1);
        assertThatThrownBy(() -> service.listEscalations(session.getId(), supervisor))
                .isInstanceOf(UnauthorizedException.class);
    }
}
