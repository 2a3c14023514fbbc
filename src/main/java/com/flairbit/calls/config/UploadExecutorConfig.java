package com.flairbit.calls.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class UploadExecutorConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService segmentUploadExecutor(CallsProperties properties) {
        CallsProperties.Recording cfg = properties.getRecording();
        AtomicInteger counter = new AtomicInteger();
        return new ThreadPoolExecutor(
                cfg.getUploadWorkers(), cfg.getUploadWorkers(),
                60L, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(cfg.getUploadQueueCapacity()),
                runnable -> {
                    Thread t = new Thread(runnable);
                    t.setName("segment-upload-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                // the finalizing caller uploads itself when the pool is saturated
                new ThreadPoolExecutor.CallerRunsPolicy());
    }
}
