package com.flairbit.calls.scheduler;

import com.flairbit.calls.config.RabbitConfig;
import com.flairbit.calls.dto.CallEventMessage;
import com.flairbit.calls.models.CallEventOutbox;
import com.flairbit.calls.models.CallSession;
import com.flairbit.calls.models.LifecycleEventType;
import com.flairbit.calls.support.CallsFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class OutboxPublisherTest {

    private CallsFixture f;
    private RabbitTemplate rabbit;
    private OutboxPublisher publisher;
    private CallSession session;

    @BeforeEach
    void setUp() {
        f = new CallsFixture();
        rabbit = mock(RabbitTemplate.class);
        publisher = new OutboxPublisher(f.outboxRepo, rabbit, f.messaging, f.json, f.clock);
        session = f.connectedCall();
        clearInvocations(f.messaging);
    }

    @AfterEach
    void tearDown() {
        publisher.shutdown();
        f.close();
    }

    @Test
    void publishesToExchangeAndCallTopic() {
        publisher.publish();

        ArgumentCaptor<CallEventMessage> sent = ArgumentCaptor.forClass(CallEventMessage.class);
        verify(rabbit).convertAndSend(eq(RabbitConfig.EVENTS_EXCHANGE), eq("call.ringing"), sent.capture());
        verify(rabbit).convertAndSend(eq(RabbitConfig.EVENTS_EXCHANGE), eq("call.connected"), any(CallEventMessage.class));
        verify(f.messaging, times(2)).convertAndSend(eq("/topic/calls." + session.getId()), any(CallEventMessage.class));

        CallEventMessage ringing = sent.getValue();
        assertThat(ringing.getType()).isEqualTo(LifecycleEventType.CALL_RINGING);
        assertThat(ringing.getCallId()).isEqualTo(session.getId());
        assertThat(ringing.getCursor()).isPositive();
        assertThat(publisher.getProcessedCount()).isEqualTo(2);
    }

    @Test
    void publishedEventsAreNotResent() {
        publisher.publish();
        clearInvocations(rabbit);

        publisher.publish();

        verify(rabbit, never()).convertAndSend(any(String.class), any(String.class), any(CallEventMessage.class));
    }

    @Test
    void failedPublishIsRetriedAfterBackoff() {
        doThrow(new AmqpException("broker unreachable")).doNothing()
                .when(rabbit).convertAndSend(eq(RabbitConfig.EVENTS_EXCHANGE), eq("call.ringing"), any(CallEventMessage.class));

        publisher.publish();

        assertThat(publisher.getFailedCount()).isEqualTo(1);
        CallEventOutbox pending = f.outboxRepo.findByCall(session.getId()).stream()
                .filter(e -> e.getType() == LifecycleEventType.CALL_RINGING)
                .findFirst().orElseThrow();
        assertThat(pending.getRetryCount()).isEqualTo(1);
        assertThat(pending.getNextRetryAt()).isEqualTo(f.clock.instant().plusSeconds(2));

        publisher.publish();
        verify(rabbit, times(1)).convertAndSend(eq(RabbitConfig.EVENTS_EXCHANGE), eq("call.ringing"), any(CallEventMessage.class));

        f.clock.advanceSeconds(2);
        publisher.publish();

        verify(rabbit, times(2)).convertAndSend(eq(RabbitConfig.EVENTS_EXCHANGE), eq("call.ringing"), any(CallEventMessage.class));
        assertThat(publisher.getProcessedCount()).isEqualTo(2);
    }

    @Test
    void messagesCarryThePayloadAsJson() throws Exception {
        List<CallEventOutbox> rows = f.outboxRepo.findByCall(session.getId());

        CallEventMessage message = publisher.toMessage(rows.get(0));

        assertThat(message.getEventId()).isEqualTo(rows.get(0).getEventId());
        assertThat(message.getData().isObject()).isTrue();
    }
}
