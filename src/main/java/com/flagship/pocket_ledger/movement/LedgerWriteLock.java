package com.flagship.pocket_ledger.movement;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Single serialization point for ledger writes.
 *
 * Each write runs its read-modify-write inside one transaction while holding the lock,
 * and the transaction commits before the lock is released. The lock is reentrant, so a
 * composite operation (a transfer, a cascade) may call other guarded operations.
 */
@Component
public class LedgerWriteLock {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final TransactionTemplate transactionTemplate;

    @Autowired
    public LedgerWriteLock(ObjectProvider<PlatformTransactionManager> transactionManager) {
        PlatformTransactionManager manager = transactionManager.getIfAvailable();
        this.transactionTemplate = manager != null ? new TransactionTemplate(manager) : null;
    }

    /**
     * Lock without transaction support, for callers that run outside Spring.
     */
    public LedgerWriteLock() {
        this.transactionTemplate = null;
    }

    public <T> T execute(Supplier<T> action) {
        lock.lock();
        try {
            if (transactionTemplate == null) {
                return action.get();
            }
            return transactionTemplate.execute(status -> action.get());
        } finally {
            lock.unlock();
        }
    }

    public void run(Runnable action) {
        execute(() -> {
            action.run();
            return null;
        });
    }
}
