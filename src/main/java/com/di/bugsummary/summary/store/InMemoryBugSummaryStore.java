package com.di.bugsummary.summary.store;

import com.di.bugsummary.exception.SummaryCorruptionException;
import com.di.bugsummary.summary.model.BugSummaryKey;
import com.di.bugsummary.summary.view.BugSummaryFilter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of BugSummaryStore. Suitable for single-node and testing.
 * When bugsummary.persistence-enabled=true, JdbcBugSummaryStore is used instead.
 *
 * <p>Each operation is atomic per key. Inside a transaction of
 * {@link InMemorySummaryTransactionManager} every change registers its undo, so a rolled back
 * rollup leaves no applied bucket behind. The rollup lock is a no-op here: the transaction
 * already excludes other in-memory transactions.
 */
@Component
@ConditionalOnProperty(name = "bugsummary.persistence-enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryBugSummaryStore implements BugSummaryStore {

    private final Map<BugSummaryKey, Entry> rows = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);

    private record Entry(long id, int count) {
    }

    @Override
    public int increment(BugSummaryKey key, int delta) {
        AtomicReference<Entry> before = new AtomicReference<>();
        try {
            rows.computeIfPresent(key, (k, e) -> {
                Entry next = new Entry(e.id(), Math.addExact(e.count(), delta));
                before.set(e);
                return next;
            });
        } catch (ArithmeticException e) {
            throw SummaryCorruptionException.overflow(key, delta, e);
        }
        Entry previous = before.get();
        if (previous == null) {
            return 0;
        }
        InMemorySummaryTransactionManager.onRollback(() -> rows.put(key, previous));
        return 1;
    }

    @Override
    public void insert(BugSummaryKey key, int count) {
        Entry created = new Entry(nextId.getAndIncrement(), count);
        if (rows.putIfAbsent(key, created) != null) {
            throw new DuplicateKeyException("Summary row already exists for " + key);
        }
        InMemorySummaryTransactionManager.onRollback(() -> rows.remove(key, created));
    }

    @Override
    public OptionalInt findCount(BugSummaryKey key) {
        Entry e = rows.get(key);
        return e == null ? OptionalInt.empty() : OptionalInt.of(e.count());
    }

    @Override
    public int deleteIfZero(BugSummaryKey key) {
        AtomicReference<Entry> deleted = new AtomicReference<>();
        rows.computeIfPresent(key, (k, e) -> {
            if (e.count() == 0) {
                deleted.set(e);
                return null;
            }
            return e;
        });
        Entry removed = deleted.get();
        if (removed == null) {
            return 0;
        }
        InMemorySummaryTransactionManager.onRollback(() -> rows.put(key, removed));
        return 1;
    }

    @Override
    public void lockForRollup() {
        // held by the in-memory transaction
    }

    @Override
    public List<BugSummaryRow> findAll(BugSummaryFilter filter) {
        BugSummaryFilter f = filter != null ? filter : BugSummaryFilter.ALL;
        return rows.entrySet().stream()
                .filter(e -> f.matches(e.getKey()))
                .map(e -> new BugSummaryRow(e.getValue().id(), e.getKey(), e.getValue().count()))
                .sorted(Comparator.comparingLong(BugSummaryRow::id))
                .toList();
    }

    @Override
    public List<BugSummaryRow> findNonPositive() {
        return rows.entrySet().stream()
                .filter(e -> e.getValue().count() <= 0)
                .map(e -> new BugSummaryRow(e.getValue().id(), e.getKey(), e.getValue().count()))
                .sorted(Comparator.comparingLong(BugSummaryRow::id))
                .toList();
    }

    public int size() {
        return rows.size();
    }
}
