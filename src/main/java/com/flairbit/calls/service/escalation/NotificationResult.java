package com.flairbit.calls.service.escalation;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class NotificationResult {

    private final boolean delivered;
    private final String error;

    public static NotificationResult delivered() {
        return new NotificationResult(true, null);
    }

    public static NotificationResult failed(String error) {
        return new NotificationResult(false, error);
    }
}
