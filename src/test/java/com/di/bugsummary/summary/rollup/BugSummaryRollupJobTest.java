package com.di.bugsummary.summary.rollup;

import com.di.bugsummary.config.BugSummaryProperties;
import com.di.bugsummary.summary.SummaryFixture;
import com.di.bugsummary.summary.model.BugSummaryDelta;
import com.di.bugsummary.summary.model.BugSummaryKey;
import com.di.bugsummary.summary.model.BugTarget;
import com.di.bugsummary.summary.model.BugTaskImportance;
import com.di.bugsummary.summary.model.BugTaskStatus;
import com.di.bugsummary.summary.store.InMemoryBugSummaryStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BugSummaryRollupJob Tests")
class BugSummaryRollupJobTest {

    private static BugSummaryKey key(String tag) {
        return BugSummaryKey.builder()
                .target(BugTarget.distribution(3))
                .tag(tag)
                .status(BugTaskStatus.TRIAGED)
                .importance(BugTaskImportance.MEDIUM)
                .build();
    }

    private static void journal(SummaryFixture fx, String... tags) {
        for (String tag : tags) {
            fx.journal.append(List.of(BugSummaryDelta.plus(key(tag))));
        }
    }

    @Test
    @DisplayName("Should drain the journal in batches of the configured size")
    void testDrain_BatchesUntilEmpty() {
        SummaryFixture fx = new SummaryFixture();
        fx.properties.getRollup().setBatchSize(2);
        journal(fx, "a", "b", "c", "d", "e");

        int batches = new BugSummaryRollupJob(fx.service, fx.properties).drain();

        assertEquals(3, batches);
        assertTrue(fx.service.isJournalDrained());
        assertEquals(OptionalInt.of(1), fx.store.findCount(key("e")));
    }

    @Test
    @DisplayName("Should run no batch when the journal is already drained")
    void testDrain_NothingPending() {
        SummaryFixture fx = new SummaryFixture();
        assertEquals(0, new BugSummaryRollupJob(fx.service, fx.properties).drain());
    }

    @Test
    @DisplayName("Should stop after a batch that deferred buckets")
    void testDrain_StopsOnDeferred() {
        SummaryFixture fx = new SummaryFixture();
        fx.properties.getRollup().setBatchSize(2);
        fx.store.insert(key("full"), Integer.MAX_VALUE);
        journal(fx, "full", "b", "c");

        int batches = new BugSummaryRollupJob(fx.service, fx.properties).drain();

        assertEquals(1, batches);
        // "c" from the first mark onwards plus the re-journaled "full"
        assertEquals(2, fx.service.journalSize());
    }

    @Test
    @DisplayName("Should stop starting batches once the maximum duration has passed")
    void testDrain_StopsAtMaxDuration() {
        SummaryFixture fx = new SummaryFixture();
        fx.properties.getRollup().setBatchSize(1);
        fx.properties.getRollup().setMaxDuration(Duration.ZERO);
        journal(fx, "a", "b", "c");

        int batches = new BugSummaryRollupJob(fx.service, fx.properties).drain();

        assertEquals(1, batches);
        assertEquals(2, fx.service.journalSize());
    }

    @Test
    @DisplayName("Should log and swallow a failed scheduled drain and clear the job id")
    void testRun_FailureDoesNotPropagate() {
        InMemoryBugSummaryStore broken = new InMemoryBugSummaryStore() {
            @Override
            public void lockForRollup() {
                throw new IllegalStateException("lock table missing");
            }
        };
        SummaryFixture fx = new SummaryFixture(new BugSummaryProperties(), broken);
        journal(fx, "a");

        BugSummaryRollupJob job = new BugSummaryRollupJob(fx.service, fx.properties);
        assertDoesNotThrow(job::run);
        assertEquals(1, fx.service.journalSize());
        assertNull(MDC.get("jobId"));
    }
}
