package com.di.bugsummary.summary;

import com.di.bugsummary.aspect.LogTransaction;
import com.di.bugsummary.config.BugSummaryConfiguration;
import com.di.bugsummary.config.BugSummaryProperties;
import com.di.bugsummary.summary.fanout.BugSummaryFanOut;
import com.di.bugsummary.summary.journal.BugSummaryJournal;
import com.di.bugsummary.summary.model.BugSummaryDelta;
import com.di.bugsummary.summary.model.BugTaskFact;
import com.di.bugsummary.summary.rollup.BugSummaryRollup;
import com.di.bugsummary.summary.rollup.RollupResult;
import com.di.bugsummary.summary.store.BugSummaryRow;
import com.di.bugsummary.summary.store.BugSummaryStore;
import com.di.bugsummary.summary.view.BugSummaryCount;
import com.di.bugsummary.summary.view.BugSummaryFilter;
import com.di.bugsummary.summary.view.BugSummaryQueryService;
import com.di.bugsummary.summary.view.TagCount;
import com.di.bugsummary.util.BugSummaryMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.Collection;
import java.util.List;
import java.util.stream.Stream;

/**
 * Entry points of the bug summary for the rest of the application.
 *
 * <p>{@link #onFactRowChanged} is called by whatever writes bug task rows, inside the same
 * transaction, with the row before and after the change ({@code null} for an insert or delete).
 * The resulting deltas are journaled there and folded into the aggregate table later by the
 * scheduled rollup, or right after commit when inline rollup is enabled.
 */
@Slf4j
@Service
public class BugSummaryService {

    private static final Object INLINE_ROLLUP_KEY = new Object();

    private final BugSummaryFanOut fanOut;
    private final BugSummaryJournal journal;
    private final BugSummaryRollup rollup;
    private final BugSummaryStore store;
    private final BugSummaryQueryService queryService;
    private final BugSummaryMetrics metrics;
    private final BugSummaryProperties properties;
    private final TransactionOperations requiredTx;
    private final TransactionOperations requiresNewTx;

    public BugSummaryService(BugSummaryFanOut fanOut,
                             BugSummaryJournal journal,
                             BugSummaryRollup rollup,
                             BugSummaryStore store,
                             BugSummaryQueryService queryService,
                             BugSummaryMetrics metrics,
                             BugSummaryProperties properties,
                             @Qualifier(BugSummaryConfiguration.REQUIRED_TX) TransactionOperations requiredTx,
                             @Qualifier(BugSummaryConfiguration.REQUIRES_NEW_TX) TransactionOperations requiresNewTx) {
        this.fanOut = fanOut;
        this.journal = journal;
        this.rollup = rollup;
        this.store = store;
        this.queryService = queryService;
        this.metrics = metrics;
        this.properties = properties;
        this.requiredTx = requiredTx;
        this.requiresNewTx = requiresNewTx;
    }

    /**
     * Journals the summary deltas of one fact row change.
     *
     * @param oldFact row before the change, null for an insert
     * @param newFact row after the change, null for a delete
     * @return number of journal entries written
     */
    @LogTransaction(eventType = "FACT_CHANGE", transactionContext = "bugsummary_fanout",
            parameterNames = {"oldFact", "newFact"}, includeResult = true)
    public int onFactRowChanged(BugTaskFact oldFact, BugTaskFact newFact) {
        List<BugSummaryDelta> deltas;
        if (oldFact == null && newFact == null) {
            throw new IllegalArgumentException("Either the old or the new fact row is required");
        } else if (oldFact == null) {
            deltas = fanOut.forInsert(newFact);
        } else if (newFact == null) {
            deltas = fanOut.forDelete(oldFact);
        } else {
            deltas = fanOut.forUpdate(oldFact, newFact);
        }

        Integer written = requiredTx.execute(status -> {
            int n = journal.append(deltas);
            if (n > 0 && properties.getRollup().isInlineEnabled()) {
                scheduleInlineRollup();
            }
            return n;
        });
        int entries = written != null ? written : 0;
        metrics.recordJournalAppended(entries);
        log.debug("[JOURNAL] task={} journaled {} entries",
                newFact != null ? newFact.getTaskId() : oldFact.getTaskId(), entries);
        return entries;
    }

    /**
     * Runs one rollup batch now.
     *
     * @param maxBatch journal entries to fold at most; null folds everything present
     */
    @LogTransaction(eventType = "ROLLUP", transactionContext = "bugsummary_rollup",
            parameterNames = {"maxBatch"}, includeResult = true)
    public RollupResult runCompaction(Integer maxBatch) {
        if (maxBatch != null && maxBatch < 1) {
            throw new IllegalArgumentException("maxBatch must be at least 1: " + maxBatch);
        }
        return rollup.compact(maxBatch);
    }

    public boolean isJournalDrained() {
        return rollup.isDone();
    }

    public long journalSize() {
        return journal.size();
    }

    public Stream<BugSummaryCount> queryAggregates(BugSummaryFilter filter) {
        return queryService.queryAggregates(filter != null ? filter : BugSummaryFilter.ALL);
    }

    public List<TagCount> tagOpenCounts(BugSummaryFilter context, Long userId, Integer tagLimit,
                                        Collection<String> includeTags) {
        return queryService.tagOpenCounts(context, userId, tagLimit, includeTags);
    }

    /**
     * Aggregate rows with a count of zero or less. Such rows are never written by a correct
     * rollup; fixing them needs a recompute of the affected buckets from the fact table.
     */
    @LogTransaction(eventType = "INTEGRITY_CHECK", transactionContext = "bugsummary_integrity",
            includeResult = true)
    public List<BugSummaryRow> checkIntegrity() {
        List<BugSummaryRow> bad = store.findNonPositive();
        for (BugSummaryRow row : bad) {
            metrics.recordCorruption();
            log.error("[INTEGRITY] Aggregate row {} has count {} for {}", row.id(), row.count(), row.key());
        }
        if (bad.isEmpty()) {
            log.info("[INTEGRITY] No non-positive aggregate rows");
        }
        return bad;
    }

    /** At most once per transaction, after commit. */
    private void scheduleInlineRollup() {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            runInlineRollup();
            return;
        }
        if (TransactionSynchronizationManager.hasResource(INLINE_ROLLUP_KEY)) {
            return;
        }
        TransactionSynchronizationManager.bindResource(INLINE_ROLLUP_KEY, Boolean.TRUE);
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                runInlineRollup();
            }

            @Override
            public void afterCompletion(int status) {
                TransactionSynchronizationManager.unbindResourceIfPossible(INLINE_ROLLUP_KEY);
            }
        });
    }

    private void runInlineRollup() {
        try {
            requiresNewTx.executeWithoutResult(status ->
                    rollup.tryCompact(properties.getRollup().getInlineBatchSize()));
        } catch (RuntimeException e) {
            log.warn("[ROLLUP] Inline rollup failed; entries stay journaled for the scheduled rollup: {}",
                    e.getMessage());
        }
    }
}
