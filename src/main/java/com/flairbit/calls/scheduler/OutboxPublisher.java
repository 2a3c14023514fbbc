package com.flairbit.calls.scheduler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flairbit.calls.config.RabbitConfig;
import com.flairbit.calls.dto.CallEventMessage;
import com.flairbit.calls.models.CallEventOutbox;
import com.flairbit.calls.repo.CallEventOutboxJDBCRepository;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Publishes lifecycle events from the outbox to the {@code calls.events} exchange (routing key =
 * event type) and to STOMP {@code /topic/calls.{callId}}.
 */
@Component
@Slf4j
public class OutboxPublisher {

    private static final int BATCH_SIZE = 500;
    private static final long CLAIM_SECONDS = 60;

    private final CallEventOutboxJDBCRepository outboxRepo;
    private final RabbitTemplate rabbitTemplate;
    private final SimpMessagingTemplate messaging;
    private final ObjectMapper json;
    private final Clock clock;

    private final int parallelWorkers = Math.max(2, Runtime.getRuntime().availableProcessors());
    private final ExecutorService executor = Executors.newFixedThreadPool(parallelWorkers, runnable -> {
        Thread t = new Thread(runnable);
        t.setName("outbox-worker-" + t.getId());
        t.setDaemon(true);
        return t;
    });

    private final AtomicLong processedCounter = new AtomicLong();
    private final AtomicLong failedCounter = new AtomicLong();

    public OutboxPublisher(CallEventOutboxJDBCRepository outboxRepo, RabbitTemplate rabbitTemplate,
                           SimpMessagingTemplate messaging, ObjectMapper json, Clock clock) {
        this.outboxRepo = outboxRepo;
        this.rabbitTemplate = rabbitTemplate;
        this.messaging = messaging;
        this.json = json;
        this.clock = clock;
    }

    /**
     * Claims rows with SELECT ... FOR UPDATE SKIP LOCKED and pushes next_retry_at past the claim
     * window, so other instances skip them while this one publishes.
     */
    @Scheduled(fixedDelayString = "${calls.outbox.fixed-delay-ms:1000}")
    public void publish() {
        try {
            List<CallEventOutbox> batch;
            do {
                Instant now = clock.instant();
                batch = outboxRepo.claimPendingBatch(now, BATCH_SIZE, now.plusSeconds(CLAIM_SECONDS));
                if (batch.isEmpty()) break;

                List<CompletableFuture<Void>> futures = batch.stream()
                        .map(o -> CompletableFuture.runAsync(() -> processEvent(o), executor)
                                .exceptionally(ex -> {
                                    log.error("Processing failed for event {} : {}", o.getEventId(), ex.getMessage());
                                    return null;
                                }))
                        .toList();

                CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            } while (batch.size() == BATCH_SIZE);

        } catch (Exception e) {
            log.error("OutboxPublisher main loop failed: {}", e.getMessage(), e);
        }
    }

    void processEvent(CallEventOutbox o) {
        try {
            CallEventMessage message = toMessage(o);
            rabbitTemplate.convertAndSend(RabbitConfig.EVENTS_EXCHANGE, o.getType().getValue(), message);
            messaging.convertAndSend("/topic/calls." + o.getCallId(), message);

            outboxRepo.markProcessed(o.getCursor(), o.getRetryCount(), clock.instant());
            processedCounter.incrementAndGet();
        } catch (Exception e) {
            log.error("Outbox publish failed for event {} : {}", o.getEventId(), e.getMessage());
            handleFailure(o);
        }
    }

    public CallEventMessage toMessage(CallEventOutbox o) throws JsonProcessingException {
        return CallEventMessage.builder()
                .cursor(o.getCursor())
                .eventId(o.getEventId())
                .type(o.getType())
                .callId(o.getCallId())
                .recordingId(o.getRecordingId())
                .occurredAt(o.getCreatedAt())
                .data(json.readTree(o.getPayload()))
                .build();
    }

    private void handleFailure(CallEventOutbox o) {
        int retries = o.getRetryCount() + 1;
        // exponential backoff: min(60s, 2^retries)
        long seconds = Math.min(60L, (long) Math.pow(2, Math.min(retries, 10)));
        outboxRepo.markRetry(o.getCursor(), retries, clock.instant().plusSeconds(seconds));
        failedCounter.incrementAndGet();

        if (retries > 10) {
            log.error("Event {} exceeded {} publish attempts, still retrying every minute", o.getEventId(), retries);
        }
    }

    @PreDestroy
    public void shutdown() {
        try {
            executor.shutdown();
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    public long getProcessedCount() { return processedCounter.get(); }
    public long getFailedCount() { return failedCounter.get(); }
}
