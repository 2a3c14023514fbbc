package com.flairbit.calls.security;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed one-minute buckets of signaling messages per sender.
 */
public class RateLimiter {

    private static final Cache<String, AtomicInteger> limiter = Caffeine.newBuilder()
            .expireAfterWrite(2, TimeUnit.MINUTES)
            .build();

    private RateLimiter() {
    }

    public static boolean allow(UUID sender, int perMinute) {
        String minuteKey = sender + ":" + (System.currentTimeMillis() / 60000);

        // get(key, mappingFunction) is atomic
        AtomicInteger count = limiter.get(minuteKey, k -> new AtomicInteger(0));

        return count.incrementAndGet() <= perMinute;
    }
}
