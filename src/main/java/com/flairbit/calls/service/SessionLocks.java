package com.flairbit.calls.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-call mutual exclusion. Locks are weakly held so idle calls do not pin memory;
 * a lock is only collected once no thread references it.
 * <p>
 * Inside a transaction the lock is released when the transaction completes, not when the
 * action returns, so the next holder always reads committed state.
 */
@Component
public class SessionLocks {

    private final Cache<UUID, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build();

    public <T> T call(UUID key, Supplier<T> action) {
        ReentrantLock lock = locks.get(key, k -> new ReentrantLock());
        lock.lock();
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            try {
                return action.get();
            } finally {
                lock.unlock();
            }
        }
        try {
            TransactionSynchronizationManager.registerSynchronization(new UnlockOnCompletion(lock));
        } catch (RuntimeException e) {
            lock.unlock();
            throw e;
        }
        return action.get();
    }

    public void run(UUID key, Runnable action) {
        call(key, () -> {
            action.run();
            return null;
        });
    }

    /** True when the current thread holds the lock for this key. */
    public boolean isHeldByCurrentThread(UUID key) {
        ReentrantLock lock = locks.getIfPresent(key);
        return lock != null && lock.isHeldByCurrentThread();
    }

    private static final class UnlockOnCompletion implements TransactionSynchronization {

        private final ReentrantLock lock;

        private UnlockOnCompletion(ReentrantLock lock) {
            this.lock = lock;
        }

        @Override
        public void afterCompletion(int status) {
            lock.unlock();
        }
    }
}
