package com.di.bugsummary.exception;

/**
 * Base class of the failures raised while maintaining the bug summary. The rollup isolates a
 * bucket that fails with one of these and re-journals its delta; anything else aborts the batch.
 */
public abstract class BugSummaryException extends RuntimeException {

    protected BugSummaryException(String message) {
        super(message);
    }

    protected BugSummaryException(String message, Throwable cause) {
        super(message, cause);
    }

    /** True when repeating the same operation later may succeed. */
    public boolean isRetryable() {
        return false;
    }
}
