package com.di.bugsummary.summary.view;

import com.di.bugsummary.summary.model.BugSummaryKey;

/**
 * Current count of one bucket: its aggregate row plus every pending journal delta.
 */
public record BugSummaryCount(BugSummaryKey key, long count) {
}
