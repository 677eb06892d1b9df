package com.di.bugsummary.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Binding for the {@code bugsummary.*} settings.
 *
 * <pre>
 * bugsummary:
 *   persistence-enabled: true
 *   rollup:
 *     batch-size: 5000
 *     schedule-enabled: true
 *     fixed-delay-ms: 60000
 *     max-duration: 5m
 *     inline-enabled: false
 *     inline-batch-size: 100
 *   upsert:
 *     max-attempts: 10
 *   access-cache:
 *     enabled: true
 *     max-size: 10000
 *     expire-after-write-minutes: 5
 * </pre>
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "bugsummary")
public class BugSummaryProperties {

    /** JDBC stores against the configured datasource when true, in-memory stores otherwise. */
    private boolean persistenceEnabled = false;

    @Valid
    private Rollup rollup = new Rollup();

    @Valid
    private Upsert upsert = new Upsert();

    @Valid
    private AccessCache accessCache = new AccessCache();

    @Data
    public static class Rollup {
        /** Journal entries folded per rollup transaction. */
        @Min(1)
        private int batchSize = 5000;

        private boolean scheduleEnabled = false;

        @Min(1)
        private long fixedDelayMs = 60_000L;

        /** A scheduled drain stops starting new batches after this long. */
        @NotNull
        private Duration maxDuration = Duration.ofMinutes(5);

        /** Run a small rollup after each committed fact change. */
        private boolean inlineEnabled = false;

        @Min(1)
        private int inlineBatchSize = 100;
    }

    @Data
    public static class Upsert {
        /** Update-then-insert rounds before giving up with a transient conflict. */
        @Min(1)
        private int maxAttempts = 10;
    }

    @Data
    public static class AccessCache {
        private boolean enabled = true;

        @Min(1)
        private long maxSize = 10_000L;

        @Min(1)
        private long expireAfterWriteMinutes = 5L;
    }
}
