package com.di.bugsummary.summary.rollup;

import com.di.bugsummary.aspect.ErrorCategory;
import com.di.bugsummary.config.BugSummaryConfiguration;
import com.di.bugsummary.exception.BugSummaryException;
import com.di.bugsummary.summary.counter.BugSummaryCounter;
import com.di.bugsummary.summary.journal.BugSummaryJournal;
import com.di.bugsummary.summary.journal.JournalEntry;
import com.di.bugsummary.summary.model.BugSummaryDelta;
import com.di.bugsummary.summary.model.BugSummaryKey;
import com.di.bugsummary.summary.store.BugSummaryStore;
import com.di.bugsummary.util.BugSummaryMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Folds the journal into the aggregate table, one bounded batch per transaction.
 *
 * <p>A batch takes the rollup lock, fixes a high-water mark, nets the entries at or below it per
 * key, applies each non-zero net through {@link BugSummaryCounter} and deletes the entries it
 * read, all in one transaction. Each bucket is applied under its own savepoint: a bucket failing
 * with a {@link BugSummaryException} is rolled back and its net delta journaled again, while the
 * rest of the batch commits. So is a bucket whose net does not fit a counter; its net goes back
 * to the journal in counter-sized entries. Any other failure rolls back the whole batch, applied
 * buckets included, and leaves the journal as it was.
 */
@Slf4j
@Component
public class BugSummaryRollup {

    private final BugSummaryJournal journal;
    private final BugSummaryStore store;
    private final BugSummaryCounter counter;
    private final BugSummaryMetrics metrics;
    private final TransactionOperations requiredTx;
    private final TransactionOperations nestedTx;
    private final ReentrantLock lock = new ReentrantLock();

    public BugSummaryRollup(BugSummaryJournal journal,
                            BugSummaryStore store,
                            BugSummaryCounter counter,
                            BugSummaryMetrics metrics,
                            @Qualifier(BugSummaryConfiguration.REQUIRED_TX) TransactionOperations requiredTx,
                            @Qualifier(BugSummaryConfiguration.NESTED_TX) TransactionOperations nestedTx) {
        this.journal = journal;
        this.store = store;
        this.counter = counter;
        this.metrics = metrics;
        this.requiredTx = requiredTx;
        this.nestedTx = nestedTx;
    }

    /**
     * Runs one batch, waiting for any rollup already running in this process.
     *
     * @param maxBatch journal entries to fold at most; null folds everything present
     */
    public RollupResult compact(Integer maxBatch) {
        lock.lock();
        try {
            return runBatch(maxBatch);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs one batch unless another rollup in this process is running, in which case nothing is
     * done and the pending entries are left for that rollup or the next one.
     */
    public Optional<RollupResult> tryCompact(Integer maxBatch) {
        if (!lock.tryLock()) {
            log.debug("[ROLLUP] Rollup already running; skipping");
            return Optional.empty();
        }
        try {
            return Optional.of(runBatch(maxBatch));
        } finally {
            lock.unlock();
        }
    }

    public boolean isDone() {
        return journal.isEmpty();
    }

    private RollupResult runBatch(Integer maxBatch) {
        long start = System.currentTimeMillis();
        RollupResult result;
        try {
            result = requiredTx.execute(status -> fold(maxBatch));
        } catch (RuntimeException e) {
            long durationMs = System.currentTimeMillis() - start;
            metrics.recordRollupError(durationMs);
            log.warn("[ROLLUP] Batch rolled back after {} ms, journal left intact [{}]: {}",
                    durationMs, ErrorCategory.categorize(e).getName(), e.getMessage());
            throw e;
        }
        if (result == null || result.isEmpty()) {
            return RollupResult.empty();
        }
        long durationMs = System.currentTimeMillis() - start;
        metrics.recordRollupBatch(durationMs, result.bucketsApplied(), result.bucketsCancelled(), result.bucketsDeferred());
        log.info("[ROLLUP] Folded {} entries up to id {} into {} buckets: applied={}, cancelled={}, deferred={} ({} ms)",
                result.entriesRead(), result.highWaterMark(), result.buckets(),
                result.bucketsApplied(), result.bucketsCancelled(), result.bucketsDeferred(), durationMs);
        return result;
    }

    private RollupResult fold(Integer maxBatch) {
        store.lockForRollup();
        OptionalLong mark = journal.highWaterMark(maxBatch);
        if (mark.isEmpty()) {
            return RollupResult.empty();
        }
        List<JournalEntry> entries = journal.readUpTo(mark.getAsLong());
        if (entries.isEmpty()) {
            return RollupResult.empty();
        }

        Map<BugSummaryKey, Long> net = new LinkedHashMap<>();
        List<Long> ids = new ArrayList<>(entries.size());
        for (JournalEntry entry : entries) {
            net.merge(entry.key(), (long) entry.delta(), Long::sum);
            ids.add(entry.id());
        }

        int applied = 0;
        int cancelled = 0;
        int oversized = 0;
        List<BugSummaryDelta> deferred = new ArrayList<>();
        for (Map.Entry<BugSummaryKey, Long> bucket : net.entrySet()) {
            BugSummaryKey key = bucket.getKey();
            long sum = bucket.getValue();
            if (sum == 0) {
                cancelled++;
                continue;
            }
            if (sum != (int) sum) {
                for (BugSummaryDelta part : split(key, sum)) {
                    metrics.recordJournalAppended(journal.append(List.of(part)));
                }
                oversized++;
                log.warn("[ROLLUP] Deferring net {} for {}: does not fit a counter", sum, key);
                continue;
            }
            int delta = (int) sum;
            try {
                nestedTx.executeWithoutResult(status -> counter.apply(key, delta));
                applied++;
            } catch (BugSummaryException e) {
                deferred.add(new BugSummaryDelta(key, delta));
                log.warn("[ROLLUP] Deferring {} for {} [{}]: {}",
                        delta, key, ErrorCategory.categorize(e).getName(), e.getMessage());
            }
        }

        if (!deferred.isEmpty()) {
            metrics.recordJournalAppended(journal.append(deferred));
        }
        int deleted = journal.delete(ids);
        if (deleted != ids.size()) {
            log.warn("[ROLLUP] Deleted {} of {} folded journal entries; another rollup may have run concurrently",
                    deleted, ids.size());
        }
        return new RollupResult(mark.getAsLong(), entries.size(), net.size(), applied, cancelled,
                deferred.size() + oversized);
    }

    /** Splits {@code sum} into deltas that each fit a counter, one journal entry apiece. */
    static List<BugSummaryDelta> split(BugSummaryKey key, long sum) {
        List<BugSummaryDelta> parts = new ArrayList<>();
        long rest = sum;
        while (rest != 0) {
            int part = (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, rest));
            parts.add(new BugSummaryDelta(key, part));
            rest -= part;
        }
        return parts;
    }
}
