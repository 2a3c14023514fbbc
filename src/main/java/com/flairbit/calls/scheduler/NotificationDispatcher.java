package com.flairbit.calls.scheduler;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flairbit.calls.config.CallsProperties;
import com.flairbit.calls.dto.EscalationNotification;
import com.flairbit.calls.models.NotificationDispatch;
import com.flairbit.calls.repo.NotificationDispatchJDBCRepository;
import com.flairbit.calls.service.escalation.NotificationChannel;
import com.flairbit.calls.service.escalation.NotificationChannelRegistry;
import com.flairbit.calls.service.escalation.NotificationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * At-least-once delivery of escalation alerts, independent of the evaluation tick. The escalation
 * record is already committed when a dispatch row exists, so a channel outage only delays the alert.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationDispatcher {

    private static final int MAX_ERROR_LENGTH = 500;

    private final NotificationDispatchJDBCRepository dispatchRepo;
    private final NotificationChannelRegistry channels;
    private final CallsProperties properties;
    private final ObjectMapper json;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${calls.notifications.fixed-delay-ms:2000}")
    public void dispatchDue() {
        try {
            int handled = dispatchBatch();
            if (handled > 0) {
                log.debug("Handled {} notification dispatches", handled);
            }
        } catch (Exception e) {
            log.error("NotificationDispatcher loop failed: {}", e.getMessage(), e);
        }
    }

    public int dispatchBatch() {
        Instant now = clock.instant();
        CallsProperties.Notifications cfg = properties.getNotifications();
        List<NotificationDispatch> due = dispatchRepo.claimDue(now, cfg.getBatchSize(), now.plus(Duration.ofMinutes(1)));
        due.forEach(this::deliver);
        return due.size();
    }

    private void deliver(NotificationDispatch dispatch) {
        int attempts = dispatch.getAttempts() + 1;
        Optional<NotificationChannel> channel = channels.find(dispatch.getChannel());
        if (channel.isEmpty()) {
            log.error("Dispatch {} targets unknown or disabled channel '{}', giving up", dispatch.getId(), dispatch.getChannel());
            dispatchRepo.markFailed(dispatch.getId(), attempts, "channel not enabled: " + dispatch.getChannel());
            return;
        }

        NotificationResult result;
        try {
            EscalationNotification notification = json.readValue(dispatch.getPayload(), EscalationNotification.class);
            result = channel.get().send(dispatch.getRecipientRole(), notification);
        } catch (Exception e) {
            result = NotificationResult.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        if (result.isDelivered()) {
            dispatchRepo.markSent(dispatch.getId(), attempts, clock.instant());
            log.info("Escalation alert {} sent via {} to {}", dispatch.getEscalationEventId(), dispatch.getChannel(), dispatch.getRecipientRole());
            return;
        }

        String error = truncate(result.getError());
        if (attempts >= properties.getNotifications().getMaxAttempts()) {
            dispatchRepo.markFailed(dispatch.getId(), attempts, error);
            log.error("Escalation alert {} via {} failed permanently after {} attempts: {}",
                    dispatch.getEscalationEventId(), dispatch.getChannel(), attempts, error);
            return;
        }
        Duration backoff = backoff(attempts);
        dispatchRepo.markRetry(dispatch.getId(), attempts, clock.instant().plus(backoff), error);
        log.warn("Escalation alert {} via {} failed (attempt {}), retrying in {}s: {}",
                dispatch.getEscalationEventId(), dispatch.getChannel(), attempts, backoff.toSeconds(), error);
    }

    /** min(max-backoff, 2^attempts seconds) */
    Duration backoff(int attempts) {
        Duration max = properties.getNotifications().getMaxBackoff();
        Duration exponential = Duration.ofSeconds((long) Math.pow(2, Math.min(attempts, 20)));
        return exponential.compareTo(max) > 0 ? max : exponential;
    }

    private static String truncate(String error) {
        if (error == null) return null;
        return error.length() > MAX_ERROR_LENGTH ? error.substring(0, MAX_ERROR_LENGTH) : error;
    }
}
