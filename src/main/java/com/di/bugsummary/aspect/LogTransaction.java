package com.di.bugsummary.aspect;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a summary entry point for STARTED / COMPLETED / FAILED event logging by
 * {@link TransactionEventAspect}.
 *
 * <pre>
 * {@code
 * @LogTransaction(eventType = "ROLLUP", transactionContext = "bugsummary_rollup",
 *                 parameterNames = {"maxBatch"}, includeResult = true)
 * public RollupResult runCompaction(Integer maxBatch) { ... }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface LogTransaction {

    /** Prefix of the logged event types, e.g. {@code ROLLUP} gives {@code ROLLUP_STARTED}. */
    String eventType();

    String transactionContext() default "";

    /**
     * Context names for the method arguments, by position. Empty means use the compiled
     * parameter names.
     */
    String[] parameterNames() default {};

    /** Adds a {@code result} entry to the COMPLETED event. */
    boolean includeResult() default false;

    /** MDC key holding the transaction id; falls back to {@code jobId}. */
    String transactionIdKey() default "transactionId";
}
