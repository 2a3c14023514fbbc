package com.flairbit.calls.service.escalation;

import com.flairbit.calls.client.SlackWebhookClient;
import com.flairbit.calls.dto.EscalationNotification;
import com.flairbit.calls.dto.SlackMessage;
import feign.FeignException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SlackNotificationChannel implements NotificationChannel {

    private final SlackWebhookClient slack;

    @Override
    public String name() {
        return "slack";
    }

    @Override
    public NotificationResult send(String recipientRole, EscalationNotification notification) {
        try {
            slack.post(new SlackMessage("@" + recipientRole + " " + notification.summary()));
            return NotificationResult.delivered();
        } catch (FeignException e) {
            return NotificationResult.failed("slack " + e.status() + ": " + e.getMessage());
        } catch (CallNotPermittedException e) {
            return NotificationResult.failed("slack circuit open");
        }
    }
}
