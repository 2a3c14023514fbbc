package com.flairbit.calls.service;

import com.flairbit.calls.support.TestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionLocksTest {

    private final SessionLocks locks = new SessionLocks();
    private final ExecutorService threads = Executors.newFixedThreadPool(2);
    private TestDatabase db;
    private TransactionTemplate tx;

    @BeforeEach
    void setUp() {
        db = TestDatabase.create();
        tx = new TransactionTemplate(db.transactionManager());
    }

    @AfterEach
    void tearDown() {
        threads.shutdownNow();
        db.shutdown();
    }

    @Test
    void lockIsReleasedWhenActionReturnsOutsideTransaction() {
        UUID key = UUID.randomUUID();

        assertThat(locks.call(key, () -> locks.isHeldByCurrentThread(key))).isTrue();
        assertThat(locks.isHeldByCurrentThread(key)).isFalse();
    }

    @Test
    void lockIsHeldUntilSurroundingTransactionCommits() throws Exception {
        UUID key = UUID.randomUUID();
        CountDownLatch actionDone = new CountDownLatch(1);
        CountDownLatch commit = new CountDownLatch(1);

        CompletableFuture<Void> holder = CompletableFuture.runAsync(() -> tx.executeWithoutResult(status -> {
            locks.run(key, () -> { });
            actionDone.countDown();
            await(commit);
        }), threads);
        assertThat(actionDone.await(5, TimeUnit.SECONDS)).isTrue();

        CompletableFuture<Boolean> next = CompletableFuture.supplyAsync(() -> locks.call(key, () -> true), threads);
        Thread.sleep(200);
        assertThat(next).isNotDone();

        commit.countDown();
        holder.get(5, TimeUnit.SECONDS);
        assertThat(next.get(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void rollbackReleasesLock() throws Exception {
        UUID key = UUID.randomUUID();

        assertThatThrownBy(() -> tx.executeWithoutResult(status -> locks.run(key, () -> {
            throw new IllegalStateException("boom");
        }))).isInstanceOf(IllegalStateException.class);

        assertThat(CompletableFuture.supplyAsync(() -> locks.call(key, () -> true), threads).get(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void nestedCallsInOneTransactionAreReentrant() {
        UUID key = UUID.randomUUID();

        Integer depth = tx.execute(status -> locks.call(key, () -> locks.call(key, () -> 2)));

        assertThat(depth).isEqualTo(2);
        assertThat(locks.isHeldByCurrentThread(key)).isFalse();
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
