package com.di.bugsummary.exception;

import com.di.bugsummary.summary.model.BugSummaryKey;
import lombok.Getter;

/**
 * An aggregate counter would leave its valid range. Counters are never clamped; the affected
 * bucket needs an offline recompute.
 */
@Getter
public class SummaryCorruptionException extends BugSummaryException {

    private final transient BugSummaryKey key;

    public SummaryCorruptionException(BugSummaryKey key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    public static SummaryCorruptionException overflow(BugSummaryKey key, long delta, Throwable cause) {
        return new SummaryCorruptionException(key, "Counter overflow applying " + delta + " to " + key, cause);
    }
}
