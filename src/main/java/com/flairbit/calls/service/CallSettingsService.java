package com.flairbit.calls.service;

import com.flairbit.calls.config.CallsProperties;
import com.flairbit.calls.exceptions.BadRequestException;
import com.flairbit.calls.repo.CallSettingJDBCRepository;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Admin-managed settings. Rows in {@code call_settings} override the defaults from
 * {@link CallsProperties}; reads go through a short-lived cache so a change is picked up
 * within {@code calls.settings-cache-ttl}.
 */
@Slf4j
@Service
public class CallSettingsService {

    public static final String RETENTION_DAYS = "recording.retention-days";
    public static final String IDLE_TIMEOUT_SECONDS = "signaling.idle-timeout-seconds";
    public static final String UPLOAD_MAX_ATTEMPTS = "upload.max-attempts";
    public static final String RING_TIMEOUT_SECONDS = "calls.ring-timeout-seconds";

    public static final List<String> KEYS = List.of(
            RETENTION_DAYS, IDLE_TIMEOUT_SECONDS, UPLOAD_MAX_ATTEMPTS, RING_TIMEOUT_SECONDS);

    private static final String ALL = "all";

    private final CallSettingJDBCRepository settingRepo;
    private final CallsProperties properties;
    private final Clock clock;
    private final LoadingCache<String, Map<String, String>> cache;

    public CallSettingsService(CallSettingJDBCRepository settingRepo, CallsProperties properties, Clock clock) {
        this.settingRepo = settingRepo;
        this.properties = properties;
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(properties.getSettingsCacheTtl())
                .maximumSize(1)
                .build(k -> settingRepo.findAll());
    }

    public Duration recordingRetention() {
        return Duration.ofDays(longValue(RETENTION_DAYS, properties.getRecording().getRetention().toDays()));
    }

    public Duration signalingIdleTimeout() {
        return Duration.ofSeconds(longValue(IDLE_TIMEOUT_SECONDS, properties.getSignaling().getIdleTimeout().toSeconds()));
    }

    public int uploadMaxAttempts() {
        return (int) longValue(UPLOAD_MAX_ATTEMPTS, properties.getRecording().getUploadMaxAttempts());
    }

    public Duration ringTimeout() {
        return Duration.ofSeconds(longValue(RING_TIMEOUT_SECONDS, properties.getEscalation().getRingTimeout().toSeconds()));
    }

    /** Effective values, stored or default, keyed by setting name. */
    public Map<String, String> effective() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put(RETENTION_DAYS, String.valueOf(recordingRetention().toDays()));
        values.put(IDLE_TIMEOUT_SECONDS, String.valueOf(signalingIdleTimeout().toSeconds()));
        values.put(UPLOAD_MAX_ATTEMPTS, String.valueOf(uploadMaxAttempts()));
        values.put(RING_TIMEOUT_SECONDS, String.valueOf(ringTimeout().toSeconds()));
        return values;
    }

    public void update(String key, String value, UUID updatedBy) {
        if (!KEYS.contains(key)) {
            throw new BadRequestException("Unknown setting: " + key);
        }
        long parsed = parsePositive(key, value);
        settingRepo.upsert(key, String.valueOf(parsed), updatedBy, clock.instant());
        cache.invalidateAll();
        log.info("Setting {} changed to {} by {}", key, parsed, updatedBy);
    }

    private long longValue(String key, long fallback) {
        String raw = cache.get(ALL).get(key);
        if (raw == null) return fallback;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring malformed setting {}={}, using default {}", key, raw, fallback);
            return fallback;
        }
    }

    private long parsePositive(String key, String value) {
        try {
            long parsed = Long.parseLong(value == null ? "" : value.trim());
            if (parsed <= 0) {
                throw new BadRequestException("Setting " + key + " must be positive");
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new BadRequestException("Setting " + key + " must be an integer");
        }
    }
}
