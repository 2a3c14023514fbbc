package com.flairbit.calls.service.escalation;

import com.flairbit.calls.dto.EscalationNotification;

/**
 * One delivery mechanism for escalation alerts. Implementations report failures through the
 * result instead of throwing, so the dispatcher can schedule the retry.
 */
public interface NotificationChannel {

    String name();

    NotificationResult send(String recipientRole, EscalationNotification notification);
}
