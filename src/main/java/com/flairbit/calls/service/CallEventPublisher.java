package com.flairbit.calls.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flairbit.calls.models.CallEventOutbox;
import com.flairbit.calls.models.LifecycleEventType;
import com.flairbit.calls.repo.CallEventOutboxJDBCRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Writes lifecycle events to the outbox in the caller's transaction.
 * {@link com.flairbit.calls.scheduler.OutboxPublisher} fans them out afterwards.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CallEventPublisher {

    private final CallEventOutboxJDBCRepository outboxRepo;
    private final ObjectMapper json;
    private final Clock clock;

    public UUID emit(LifecycleEventType type, UUID callId, UUID recordingId, Map<String, Object> data) {
        Instant now = clock.instant();
        UUID eventId = UUID.randomUUID();
        outboxRepo.save(CallEventOutbox.builder()
                .eventId(eventId)
                .type(type)
                .callId(callId)
                .recordingId(recordingId)
                .payload(serialize(type, data))
                .createdAt(now)
                .nextRetryAt(now)
                .build());
        log.info("Event {} {} call={} recording={}", type.getValue(), eventId, callId, recordingId);
        return eventId;
    }

    public UUID emit(LifecycleEventType type, UUID callId, Map<String, Object> data) {
        return emit(type, callId, null, data);
    }

    private String serialize(LifecycleEventType type, Map<String, Object> data) {
        try {
            return json.writeValueAsString(data == null ? Map.of() : data);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize payload for event " + type.getValue(), e);
        }
    }
}
