package com.di.bugsummary.summary.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.SavepointManager;
import org.springframework.transaction.support.AbstractPlatformTransactionManager;
import org.springframework.transaction.support.DefaultTransactionStatus;
import org.springframework.transaction.support.SmartTransactionObject;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Transactions over the in-memory store and journal.
 *
 * <p>A transaction holds the write lock of one read/write lock from begin to completion, so
 * in-memory transactions run one at a time and readers going through {@link #readLocked} never
 * see one half applied. Changes made inside a transaction register an undo action with
 * {@link #onRollback}; rollback runs them newest first. Savepoints mark a position in the undo
 * log, which makes {@code PROPAGATION_NESTED} work as with a database.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "bugsummary.persistence-enabled", havingValue = "false", matchIfMissing = true)
public class InMemorySummaryTransactionManager extends AbstractPlatformTransactionManager {

    private static final String UNDO_LOG_KEY = InMemorySummaryTransactionManager.class.getName() + ".undoLog";

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);

    public InMemorySummaryTransactionManager() {
        setNestedTransactionAllowed(true);
    }

    /**
     * Registers {@code undo} with the transaction bound to this thread. Outside a transaction the
     * change is final and nothing is recorded.
     */
    public static void onRollback(Runnable undo) {
        UndoLog undoLog = (UndoLog) TransactionSynchronizationManager.getResource(UNDO_LOG_KEY);
        if (undoLog != null) {
            undoLog.add(undo);
        }
    }

    /** Runs {@code read} while no in-memory transaction of another thread is in progress. */
    public <T> T readLocked(Supplier<T> read) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return read.get();
        } finally {
            readLock.unlock();
        }
    }

    @Override
    protected Object doGetTransaction() {
        return new InMemoryTransaction((UndoLog) TransactionSynchronizationManager.getResource(UNDO_LOG_KEY));
    }

    @Override
    protected boolean isExistingTransaction(Object transaction) {
        return ((InMemoryTransaction) transaction).undoLog != null;
    }

    @Override
    protected void doBegin(Object transaction, TransactionDefinition definition) {
        lock.writeLock().lock();
        InMemoryTransaction tx = (InMemoryTransaction) transaction;
        tx.undoLog = new UndoLog();
        TransactionSynchronizationManager.bindResource(UNDO_LOG_KEY, tx.undoLog);
    }

    @Override
    protected Object doSuspend(Object transaction) {
        ((InMemoryTransaction) transaction).undoLog = null;
        return TransactionSynchronizationManager.unbindResource(UNDO_LOG_KEY);
    }

    @Override
    protected void doResume(Object transaction, Object suspendedResources) {
        TransactionSynchronizationManager.bindResource(UNDO_LOG_KEY, suspendedResources);
    }

    @Override
    protected void doCommit(DefaultTransactionStatus status) {
        transaction(status).undoLog.clear();
    }

    @Override
    protected void doRollback(DefaultTransactionStatus status) {
        int undone = transaction(status).undoLog.rollbackTo(0);
        log.debug("[TX] Rolled back {} in-memory changes", undone);
    }

    @Override
    protected void doSetRollbackOnly(DefaultTransactionStatus status) {
        transaction(status).undoLog.rollbackOnly = true;
    }

    @Override
    protected void doCleanupAfterCompletion(Object transaction) {
        TransactionSynchronizationManager.unbindResourceIfPossible(UNDO_LOG_KEY);
        ((InMemoryTransaction) transaction).undoLog = null;
        lock.writeLock().unlock();
    }

    private static InMemoryTransaction transaction(DefaultTransactionStatus status) {
        return (InMemoryTransaction) status.getTransaction();
    }

    private static final class InMemoryTransaction implements SmartTransactionObject, SavepointManager {
        private UndoLog undoLog;

        private InMemoryTransaction(UndoLog undoLog) {
            this.undoLog = undoLog;
        }

        @Override
        public Object createSavepoint() {
            return undoLog.size();
        }

        @Override
        public void rollbackToSavepoint(Object savepoint) {
            undoLog.rollbackTo((Integer) savepoint);
        }

        @Override
        public void releaseSavepoint(Object savepoint) {
            // undo actions stay with the enclosing transaction
        }

        @Override
        public boolean isRollbackOnly() {
            return undoLog != null && undoLog.rollbackOnly;
        }

        @Override
        public void flush() {
            // nothing buffered
        }
    }

    private static final class UndoLog {
        private final List<Runnable> actions = new ArrayList<>();
        private boolean rollbackOnly;

        void add(Runnable undo) {
            actions.add(undo);
        }

        int size() {
            return actions.size();
        }

        void clear() {
            actions.clear();
        }

        int rollbackTo(int mark) {
            int undone = 0;
            for (int i = actions.size() - 1; i >= mark; i--) {
                actions.remove(i).run();
                undone++;
            }
            return undone;
        }
    }
}
