package com.flairbit.calls.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Infrastructure tunables and the defaults for admin-managed settings.
 * Values stored in {@code call_settings} take precedence over the defaults here,
 * see {@link com.flairbit.calls.service.CallSettingsService}.
 */
@Data
@ConfigurationProperties(prefix = "calls")
public class CallsProperties {

    private Signaling signaling = new Signaling();
    private Recording recording = new Recording();
    private Escalation escalation = new Escalation();
    private Notifications notifications = new Notifications();
    private Duration settingsCacheTtl = Duration.ofSeconds(10);

    @Data
    public static class Signaling {
        private Duration idleTimeout = Duration.ofMinutes(2);
        private Duration retention = Duration.ofDays(7);
        private Duration maxPollWait = Duration.ofSeconds(25);
        private int maxMessagesPerMinute = 600;
        private int drainWorkers = 8;
        private int drainQueueCapacity = 1000;
    }

    @Data
    public static class Recording {
        private Duration retention = Duration.ofDays(90);
        private String storageRoot = "/var/lib/calls/segments";
        private String spoolDir = "/var/spool/calls";
        /** Base64 encoded master secret that segment keys are derived from. */
        private String masterKey;
        private int uploadMaxAttempts = 5;
        private Duration uploadBackoff = Duration.ofMillis(500);
        private int uploadWorkers = 4;
        private int uploadQueueCapacity = 1000;
    }

    @Data
    public static class Escalation {
        private Duration ringTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Notifications {
        private List<String> enabledChannels = new ArrayList<>(List.of("stomp"));
        private int maxAttempts = 20;
        private Duration maxBackoff = Duration.ofMinutes(5);
        private int batchSize = 100;
        private Slack slack = new Slack();
        private Sms sms = new Sms();
    }

    @Data
    public static class Slack {
        private String webhookUrl;
    }

    @Data
    public static class Sms {
        private String baseUrl;
        private String apiKey;
    }
}
