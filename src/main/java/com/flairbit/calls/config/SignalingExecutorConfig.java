package com.flairbit.calls.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class SignalingExecutorConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService signalDrainExecutor(CallsProperties properties) {
        CallsProperties.Signaling cfg = properties.getSignaling();
        AtomicInteger counter = new AtomicInteger();
        return new ThreadPoolExecutor(
                cfg.getDrainWorkers(), cfg.getDrainWorkers(),
                60L, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(cfg.getDrainQueueCapacity()),
                runnable -> {
                    Thread t = new Thread(runnable);
                    t.setName("signal-drain-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                // a woken poll that cannot be queued fails; its messages stay pending for the next poll
                new ThreadPoolExecutor.AbortPolicy());
    }
}
