package com.flairbit.calls.service.escalation;

import com.flairbit.calls.client.SmsGatewayClient;
import com.flairbit.calls.config.CallsProperties;
import com.flairbit.calls.dto.EscalationNotification;
import com.flairbit.calls.dto.SmsRequest;
import feign.FeignException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * The gateway fans a message out to the on-call numbers registered for a role.
 */
@Component
@RequiredArgsConstructor
public class SmsNotificationChannel implements NotificationChannel {

    private final SmsGatewayClient gateway;
    private final CallsProperties properties;

    @Override
    public String name() {
        return "sms";
    }

    @Override
    public NotificationResult send(String recipientRole, EscalationNotification notification) {
        try {
            gateway.sendToRole(properties.getNotifications().getSms().getApiKey(),
                    SmsRequest.builder().role(recipientRole).body(notification.summary()).build());
            return NotificationResult.delivered();
        } catch (FeignException e) {
            return NotificationResult.failed("sms " + e.status() + ": " + e.getMessage());
        } catch (CallNotPermittedException e) {
            return NotificationResult.failed("sms circuit open");
        }
    }
}
