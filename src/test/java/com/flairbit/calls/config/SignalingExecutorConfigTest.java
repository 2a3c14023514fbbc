package com.flairbit.calls.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SignalingExecutorConfigTest {

    private ExecutorService executor;

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void drainPoolRejectsWorkBeyondWorkersAndQueue() throws Exception {
        CallsProperties properties = new CallsProperties();
        properties.getSignaling().setDrainWorkers(1);
        properties.getSignaling().setDrainQueueCapacity(1);
        executor = new SignalingExecutorConfig().signalDrainExecutor(properties);

        CountDownLatch running = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        executor.execute(() -> {
            running.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        assertThat(running.await(5, TimeUnit.SECONDS)).isTrue();
        executor.execute(() -> { });

        assertThatThrownBy(() -> executor.execute(() -> { }))
                .isInstanceOf(RejectedExecutionException.class);

        release.countDown();
    }
}
