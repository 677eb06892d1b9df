package com.di.bugsummary.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for the journal, the rollup and the upsert counter.
 */
@Slf4j
@Component
public class BugSummaryMetrics {

    private final MeterRegistry meterRegistry;

    // Journal
    private final Counter journalAppendedCounter;

    // Rollup
    private final Counter rollupBatchCounter;
    private final Counter rollupErrorCounter;
    private final Counter bucketsAppliedCounter;
    private final Counter bucketsCancelledCounter;
    private final Counter bucketsDeferredCounter;
    private final Timer rollupTimer;

    // Upsert
    private final Counter upsertConflictCounter;
    private final Counter upsertExhaustedCounter;
    private final Counter corruptionCounter;

    public BugSummaryMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.journalAppendedCounter = Counter.builder("bugsummary.journal.appended")
                .description("Journal entries written by fact changes and deferred buckets")
                .register(meterRegistry);

        this.rollupBatchCounter = Counter.builder("bugsummary.rollup.batches")
                .description("Rollup batches committed")
                .tag("status", "success")
                .register(meterRegistry);

        this.rollupErrorCounter = Counter.builder("bugsummary.rollup.batches")
                .description("Rollup batches rolled back")
                .tag("status", "error")
                .register(meterRegistry);

        this.bucketsAppliedCounter = Counter.builder("bugsummary.rollup.buckets")
                .description("Net bucket deltas applied to the aggregate table")
                .tag("outcome", "applied")
                .register(meterRegistry);

        this.bucketsCancelledCounter = Counter.builder("bugsummary.rollup.buckets")
                .description("Buckets whose journal entries summed to zero")
                .tag("outcome", "cancelled")
                .register(meterRegistry);

        this.bucketsDeferredCounter = Counter.builder("bugsummary.rollup.buckets")
                .description("Buckets re-journaled after a failed apply")
                .tag("outcome", "deferred")
                .register(meterRegistry);

        this.rollupTimer = Timer.builder("bugsummary.rollup.duration")
                .description("Time taken by one rollup batch")
                .register(meterRegistry);

        this.upsertConflictCounter = Counter.builder("bugsummary.upsert.conflicts")
                .description("Inserts that lost the race to a concurrent writer")
                .register(meterRegistry);

        this.upsertExhaustedCounter = Counter.builder("bugsummary.upsert.exhausted")
                .description("Upserts abandoned after the maximum number of attempts")
                .register(meterRegistry);

        this.corruptionCounter = Counter.builder("bugsummary.corruption.detected")
                .description("Aggregate rows found with a count that is not positive, or overflowing")
                .register(meterRegistry);

        log.info("[METRICS] Bug summary metrics registered");
    }

    public void recordJournalAppended(int entries) {
        if (entries > 0) {
            journalAppendedCounter.increment(entries);
        }
    }

    public void recordRollupBatch(long durationMs, int applied, int cancelled, int deferred) {
        rollupBatchCounter.increment();
        rollupTimer.record(durationMs, TimeUnit.MILLISECONDS);
        bucketsAppliedCounter.increment(applied);
        bucketsCancelledCounter.increment(cancelled);
        bucketsDeferredCounter.increment(deferred);
    }

    public void recordRollupError(long durationMs) {
        rollupErrorCounter.increment();
        rollupTimer.record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordUpsertConflict() {
        upsertConflictCounter.increment();
    }

    public void recordUpsertExhausted() {
        upsertExhaustedCounter.increment();
    }

    public void recordCorruption() {
        corruptionCounter.increment();
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }
}
