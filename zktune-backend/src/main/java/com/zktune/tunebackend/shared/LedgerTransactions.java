package com.zktune.tunebackend.shared;

import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serialization boundary for every write against the ledger.
 * <p>
 * The lock is taken before the transaction starts and released only after it has committed or
 * rolled back, so no two writes interleave and a second caller always sees the first one's
 * committed state. The lock is reentrant: a write that calls another write joins the outer
 * transaction.
 */
@Component
public class LedgerTransactions {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final TransactionTemplate transactionTemplate;

    public LedgerTransactions(TransactionTemplate transactionTemplate) {
        this.transactionTemplate = transactionTemplate;
    }

    public <T> T write(Supplier<T> work) {
        lock.lock();
        try {
            return transactionTemplate.execute(status -> work.get());
        } finally {
            lock.unlock();
        }
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    public void writeVoid(Runnable work) {
        write(() -> {
            work.run();
            return null;
        });
    }
}
