package com.flairbit.calls.service.escalation;

import com.flairbit.calls.dto.EscalationNotification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Pushes alerts to dashboards subscribed to {@code /topic/escalations.{role}}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StompNotificationChannel implements NotificationChannel {

    private final SimpMessagingTemplate messaging;

    @Override
    public String name() {
        return "stomp";
    }

    @Override
    public NotificationResult send(String recipientRole, EscalationNotification notification) {
        try {
            messaging.convertAndSend("/topic/escalations." + recipientRole, notification);
            return NotificationResult.delivered();
        } catch (MessagingException e) {
            return NotificationResult.failed(e.getMessage());
        }
    }
}
