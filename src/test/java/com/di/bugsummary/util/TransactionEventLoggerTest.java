package com.di.bugsummary.util;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Event Logging and Metrics Tests")
class TransactionEventLoggerTest {

    @Test
    @DisplayName("Should prefix the application id with the application name")
    void testApplicationId() {
        TransactionEventLogger logger = new TransactionEventLogger("bugsummary");
        assertTrue(logger.getApplicationId().startsWith("bugsummary-"));
        assertEquals("bugsummary-".length() + 8, logger.getApplicationId().length());
    }

    @Test
    @DisplayName("Should accept events without context, transaction id or exception")
    void testLogEvent_Minimal() {
        TransactionEventLogger logger = new TransactionEventLogger("bugsummary");
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("note", "quote \" and\nnewline");
        assertDoesNotThrow(() -> logger.logEvent("ROLLUP_STARTED", null, null, null));
        assertDoesNotThrow(() -> logger.logEvent("ROLLUP_FAILED", context, "tx", "bugsummary_rollup",
                new IllegalStateException("boom")));
    }

    @Test
    @DisplayName("Should keep the first lines of a stack trace")
    void testStackTraceSummary() {
        String summary = TransactionEventLogger.stackTraceSummary(new IllegalStateException("boom"));
        assertTrue(summary.startsWith("java.lang.IllegalStateException: boom"));
        assertTrue(summary.contains(" | "));
    }

    @Test
    @DisplayName("Should record rollup outcomes per tag")
    void testMetrics_RollupBatch() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        BugSummaryMetrics metrics = new BugSummaryMetrics(registry);

        metrics.recordRollupBatch(12, 3, 1, 2);
        metrics.recordRollupError(5);
        metrics.recordJournalAppended(0);
        metrics.recordJournalAppended(4);

        assertEquals(1.0, registry.get("bugsummary.rollup.batches").tag("status", "success").counter().count());
        assertEquals(1.0, registry.get("bugsummary.rollup.batches").tag("status", "error").counter().count());
        assertEquals(3.0, registry.get("bugsummary.rollup.buckets").tag("outcome", "applied").counter().count());
        assertEquals(2.0, registry.get("bugsummary.rollup.buckets").tag("outcome", "deferred").counter().count());
        assertEquals(2, registry.get("bugsummary.rollup.duration").timer().count());
        assertEquals(4.0, registry.get("bugsummary.journal.appended").counter().count());
        assertSame(registry, metrics.getMeterRegistry());
    }
}
