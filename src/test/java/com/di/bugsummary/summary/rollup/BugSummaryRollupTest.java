package com.di.bugsummary.summary.rollup;

import com.di.bugsummary.config.BugSummaryProperties;
import com.di.bugsummary.summary.SummaryFixture;
import com.di.bugsummary.summary.journal.JournalEntry;
import com.di.bugsummary.summary.model.BugSummaryDelta;
import com.di.bugsummary.summary.model.BugSummaryKey;
import com.di.bugsummary.summary.model.BugTarget;
import com.di.bugsummary.summary.model.BugTaskImportance;
import com.di.bugsummary.summary.model.BugTaskStatus;
import com.di.bugsummary.summary.store.InMemoryBugSummaryStore;
import com.di.bugsummary.summary.view.BugSummaryCount;
import com.di.bugsummary.summary.view.BugSummaryFilter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static com.di.bugsummary.summary.SummaryFixture.fact;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BugSummaryRollup Tests")
class BugSummaryRollupTest {

    private static BugSummaryKey key(String tag) {
        return BugSummaryKey.builder()
                .target(BugTarget.product(1))
                .tag(tag)
                .status(BugTaskStatus.NEW)
                .importance(BugTaskImportance.LOW)
                .build();
    }

    // ============================================================================
    // Folding
    // ============================================================================

    @Test
    @DisplayName("Should return an empty result for an empty journal")
    void testCompact_EmptyJournal() {
        SummaryFixture fx = new SummaryFixture();
        RollupResult result = fx.rollup.compact(null);
        assertTrue(result.isEmpty());
        assertEquals(-1L, result.highWaterMark());
        assertTrue(fx.rollup.isDone());
    }

    @Test
    @DisplayName("Should fold journaled fact changes into aggregate rows and empty the journal")
    void testCompact_FoldsJournal() {
        SummaryFixture fx = new SummaryFixture();
        fx.service.onFactRowChanged(null, fact(1, 100, BugTarget.product(1)).tag("ui").build());
        fx.service.onFactRowChanged(null, fact(2, 101, BugTarget.product(1)).tag("ui").build());
        assertEquals(4, fx.journal.size());

        RollupResult result = fx.rollup.compact(null);

        assertEquals(4, result.entriesRead());
        assertEquals(2, result.buckets());
        assertEquals(2, result.bucketsApplied());
        assertTrue(fx.rollup.isDone());
        assertEquals(OptionalInt.of(2), fx.store.findCount(key("ui")));
        assertEquals(OptionalInt.of(2), fx.store.findCount(key(null)));
        assertEquals(1.0, fx.counter("bugsummary.rollup.batches", "status", "success"));
    }

    @Test
    @DisplayName("Should change nothing when run again on a drained journal")
    void testCompact_Idempotent() {
        SummaryFixture fx = new SummaryFixture();
        fx.service.onFactRowChanged(null, fact(1, 100, BugTarget.product(1)).tag("ui").build());
        fx.rollup.compact(null);
        var before = fx.store.findAll(BugSummaryFilter.ALL);

        RollupResult again = fx.rollup.compact(null);

        assertTrue(again.isEmpty());
        assertEquals(before, fx.store.findAll(BugSummaryFilter.ALL));
    }

    @Test
    @DisplayName("Should write nothing for a bucket whose entries cancel out")
    void testCompact_CancelOut() {
        SummaryFixture fx = new SummaryFixture();
        fx.journal.append(List.of(BugSummaryDelta.plus(key("ui"))));
        fx.journal.append(List.of(BugSummaryDelta.minus(key("ui"))));

        RollupResult result = fx.rollup.compact(null);

        assertEquals(2, result.entriesRead());
        assertEquals(1, result.bucketsCancelled());
        assertEquals(0, result.bucketsApplied());
        assertTrue(fx.store.findAll(BugSummaryFilter.ALL).isEmpty());
        assertTrue(fx.rollup.isDone());
    }

    @Test
    @DisplayName("Should fold at most the batch size and leave later entries")
    void testCompact_BatchBound() {
        SummaryFixture fx = new SummaryFixture();
        for (String tag : List.of("a", "b", "c", "d", "e")) {
            fx.journal.append(List.of(BugSummaryDelta.plus(key(tag))));
        }

        RollupResult result = fx.rollup.compact(2);

        assertEquals(2, result.entriesRead());
        assertEquals(2L, result.highWaterMark());
        assertEquals(3, fx.journal.size());
        assertEquals(OptionalInt.of(1), fx.store.findCount(key("a")));
        assertTrue(fx.store.findCount(key("c")).isEmpty());
    }

    // ============================================================================
    // Failure isolation
    // ============================================================================

    @Test
    @DisplayName("Should defer an overflowing bucket and apply the rest of the batch")
    void testCompact_DefersFailingBucket() {
        SummaryFixture fx = new SummaryFixture();
        fx.store.insert(key("full"), Integer.MAX_VALUE);
        fx.journal.append(List.of(BugSummaryDelta.plus(key("full")), BugSummaryDelta.plus(key("ok"))));

        RollupResult result = fx.rollup.compact(null);

        assertEquals(1, result.bucketsApplied());
        assertEquals(1, result.bucketsDeferred());
        assertTrue(result.hasDeferred());
        assertEquals(OptionalInt.of(1), fx.store.findCount(key("ok")));
        assertEquals(OptionalInt.of(Integer.MAX_VALUE), fx.store.findCount(key("full")));

        List<JournalEntry> left = fx.journal.findAll(BugSummaryFilter.ALL);
        assertEquals(1, left.size());
        assertEquals(key("full"), left.get(0).key());
        assertEquals(1, left.get(0).delta());
        assertTrue(left.get(0).id() > result.highWaterMark());
        assertEquals(1.0, fx.counter("bugsummary.rollup.buckets", "outcome", "deferred"));
    }

    @Test
    @DisplayName("Should roll back applied buckets and keep the journal when a batch fails outright")
    void testCompact_FailedBatchKeepsJournal() {
        AtomicBoolean failNext = new AtomicBoolean(true);
        InMemoryBugSummaryStore flaky = new InMemoryBugSummaryStore() {
            @Override
            public OptionalInt findCount(BugSummaryKey key) {
                if (key.equals(key("crash")) && failNext.getAndSet(false)) {
                    throw new IllegalStateException("store unavailable");
                }
                return super.findCount(key);
            }
        };
        SummaryFixture fx = new SummaryFixture(new BugSummaryProperties(), flaky);
        fx.journal.append(List.of(BugSummaryDelta.plus(key("ui"))));
        fx.journal.append(List.of(BugSummaryDelta.plus(key("crash"))));

        assertThrows(IllegalStateException.class, () -> fx.rollup.compact(null));

        assertEquals(2, fx.journal.size());
        assertTrue(fx.store.findAll(BugSummaryFilter.ALL).isEmpty());
        assertEquals(1.0, fx.counter("bugsummary.rollup.batches", "status", "error"));

        RollupResult retry = fx.rollup.compact(null);

        assertEquals(2, retry.bucketsApplied());
        assertEquals(OptionalInt.of(1), fx.store.findCount(key("ui")));
        assertEquals(OptionalInt.of(1), fx.store.findCount(key("crash")));
        assertTrue(fx.rollup.isDone());
    }

    @Test
    @DisplayName("Should defer a bucket whose net does not fit a counter and apply the rest")
    void testCompact_DefersOversizedNet() {
        SummaryFixture fx = new SummaryFixture();
        fx.journal.append(List.of(new BugSummaryDelta(key("big"), Integer.MAX_VALUE)));
        fx.journal.append(List.of(new BugSummaryDelta(key("big"), Integer.MAX_VALUE)));
        fx.journal.append(List.of(BugSummaryDelta.plus(key("ok"))));

        RollupResult result = fx.rollup.compact(null);

        assertEquals(1, result.bucketsApplied());
        assertEquals(1, result.bucketsDeferred());
        assertEquals(OptionalInt.of(1), fx.store.findCount(key("ok")));
        assertTrue(fx.store.findCount(key("big")).isEmpty());

        List<JournalEntry> left = fx.journal.findAll(BugSummaryFilter.ALL);
        assertEquals(2, left.size());
        for (JournalEntry entry : left) {
            assertEquals(key("big"), entry.key());
            assertEquals(Integer.MAX_VALUE, entry.delta());
            assertTrue(entry.id() > result.highWaterMark());
        }
        long total = fx.queryService.queryAggregates(BugSummaryFilter.ALL).mapToLong(BugSummaryCount::count).sum();
        assertEquals(2L * Integer.MAX_VALUE + 1, total);
    }

    @Test
    @DisplayName("Should split a net into counter-sized deltas")
    void testSplit() {
        List<BugSummaryDelta> parts = BugSummaryRollup.split(key("big"), -2L * Integer.MAX_VALUE - 5);

        assertEquals(3, parts.size());
        assertEquals(Integer.MIN_VALUE, parts.get(0).delta());
        assertEquals(Integer.MIN_VALUE, parts.get(1).delta());
        assertEquals(-2L * Integer.MAX_VALUE - 5, parts.stream().mapToLong(BugSummaryDelta::delta).sum());
    }

    // ============================================================================
    // Serialization
    // ============================================================================

    @Test
    @DisplayName("Should skip instead of waiting when another rollup is running")
    void testTryCompact_SkipsWhileRunning() throws Exception {
        CountDownLatch inside = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        InMemoryBugSummaryStore slow = new InMemoryBugSummaryStore() {
            @Override
            public void lockForRollup() {
                inside.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
            }
        };
        SummaryFixture fx = new SummaryFixture(new BugSummaryProperties(), slow);
        fx.journal.append(List.of(BugSummaryDelta.plus(key("ui"))));

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<RollupResult> running = pool.submit(() -> fx.rollup.compact(null));
            assertTrue(inside.await(5, TimeUnit.SECONDS));

            Optional<RollupResult> skipped = fx.rollup.tryCompact(null);
            assertTrue(skipped.isEmpty());

            release.countDown();
            assertEquals(1, running.get(5, TimeUnit.SECONDS).entriesRead());
        } finally {
            release.countDown();
            pool.shutdownNow();
        }

        assertTrue(fx.rollup.tryCompact(null).orElseThrow().isEmpty());
    }

    @Test
    @DisplayName("Should keep readers out of a batch until it commits")
    void testCompact_ReadersSeeBatchOnce() throws Exception {
        AtomicReference<SummaryFixture> fixture = new AtomicReference<>();
        AtomicReference<Future<Long>> reader = new AtomicReference<>();
        AtomicBoolean readDuringBatch = new AtomicBoolean();
        ExecutorService pool = Executors.newSingleThreadExecutor();
        InMemoryBugSummaryStore watched = new InMemoryBugSummaryStore() {
            @Override
            public void insert(BugSummaryKey key, int count) {
                super.insert(key, count);
                SummaryFixture fx = fixture.get();
                Future<Long> total = pool.submit(() ->
                        fx.queryService.queryAggregates(BugSummaryFilter.ALL).mapToLong(BugSummaryCount::count).sum());
                reader.set(total);
                try {
                    total.get(200, TimeUnit.MILLISECONDS);
                    readDuringBatch.set(true);
                } catch (TimeoutException e) {
                    readDuringBatch.set(false);
                } catch (InterruptedException | ExecutionException e) {
                    throw new IllegalStateException(e);
                }
            }
        };
        SummaryFixture fx = new SummaryFixture(new BugSummaryProperties(), watched);
        fixture.set(fx);
        fx.journal.append(List.of(BugSummaryDelta.plus(key("ui"))));

        try {
            fx.rollup.compact(null);

            assertFalse(readDuringBatch.get());
            assertEquals(1L, reader.get().get(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
    }
}
