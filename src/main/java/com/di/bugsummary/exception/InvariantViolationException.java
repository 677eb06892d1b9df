package com.di.bugsummary.exception;

/**
 * A fact row or bucket key breaks a structural rule (invalid container combination, a task moved
 * to another bug). Raised before anything is journaled.
 */
public class InvariantViolationException extends BugSummaryException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
