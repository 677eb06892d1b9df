package com.di.bugsummary.summary.rollup;

import com.di.bugsummary.aspect.ErrorCategory;
import com.di.bugsummary.config.BugSummaryProperties;
import com.di.bugsummary.summary.BugSummaryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.UUID;

/**
 * Drains the journal on a fixed delay, in batches of {@code bugsummary.rollup.batch-size}.
 * A drain ends when the journal is empty, when a batch had to defer buckets, or once
 * {@code bugsummary.rollup.max-duration} has passed; the next run picks up the rest.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "bugsummary.rollup.schedule-enabled", havingValue = "true")
public class BugSummaryRollupJob {

    private final BugSummaryService service;
    private final BugSummaryProperties properties;

    @Scheduled(fixedDelayString = "${bugsummary.rollup.fixed-delay-ms:60000}",
            initialDelayString = "${bugsummary.rollup.fixed-delay-ms:60000}")
    public void run() {
        MDC.put("jobId", "rollup-" + UUID.randomUUID().toString().substring(0, 8));
        try {
            int batches = drain();
            if (batches > 0) {
                log.info("[ROLLUP] Scheduled drain finished after {} batches", batches);
            }
        } catch (RuntimeException e) {
            log.error("[ROLLUP] Scheduled drain failed [{}]", ErrorCategory.categorize(e).getName(), e);
        } finally {
            MDC.remove("jobId");
        }
    }

    /**
     * @return number of batches run
     */
    public int drain() {
        BugSummaryProperties.Rollup cfg = properties.getRollup();
        Duration maxDuration = cfg.getMaxDuration();
        long deadline = System.nanoTime() + maxDuration.toNanos();
        int batches = 0;
        while (!service.isJournalDrained()) {
            RollupResult result = service.runCompaction(cfg.getBatchSize());
            batches++;
            if (result.isEmpty() || result.hasDeferred()) {
                break;
            }
            if (System.nanoTime() - deadline >= 0) {
                log.info("[ROLLUP] Drain stopped after {} batches: max duration {} reached", batches, maxDuration);
                break;
            }
        }
        return batches;
    }
}
