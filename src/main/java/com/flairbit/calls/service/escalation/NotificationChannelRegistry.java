package com.flairbit.calls.service.escalation;

import com.flairbit.calls.config.CallsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Channels by name, restricted to {@code calls.notifications.enabled-channels}.
 */
@Slf4j
@Component
public class NotificationChannelRegistry {

    private final Map<String, NotificationChannel> enabled;

    public NotificationChannelRegistry(List<NotificationChannel> channels, CallsProperties properties) {
        List<String> names = properties.getNotifications().getEnabledChannels().stream()
                .map(n -> n.trim().toLowerCase(Locale.ROOT))
                .toList();
        this.enabled = channels.stream()
                .filter(c -> names.contains(c.name()))
                .collect(Collectors.toUnmodifiableMap(NotificationChannel::name, Function.identity()));
        log.info("Notification channels enabled: {}", enabled.keySet());
    }

    public Optional<NotificationChannel> find(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(enabled.get(name.trim().toLowerCase(Locale.ROOT)));
    }

    public boolean isEnabled(String name) {
        return find(name).isPresent();
    }
}
