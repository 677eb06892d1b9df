package com.di.bugsummary.summary.store;

import com.di.bugsummary.summary.model.BugSummaryKey;

/**
 * One row of the aggregate table.
 */
public record BugSummaryRow(long id, BugSummaryKey key, int count) {
}
