package com.di.bugsummary.exception;

import com.di.bugsummary.summary.model.BugSummaryKey;
import lombok.Getter;

/**
 * The update-or-insert loop lost the race for a bucket more times than allowed.
 */
@Getter
public class TransientConflictException extends BugSummaryException {

    private final transient BugSummaryKey key;
    private final int attempts;

    public TransientConflictException(BugSummaryKey key, int attempts, Throwable lastConflict) {
        super("Gave up upserting " + key + " after " + attempts + " attempts", lastConflict);
        this.key = key;
        this.attempts = attempts;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
