package com.di.bugsummary.summary.view;

import com.di.bugsummary.summary.model.BugSummaryKey;

/**
 * One row of the combined view: an aggregate row (positive id) or a pending journal entry
 * (negated journal id). Rows for the same key are not summed.
 */
public record CombinedSummaryRow(long id, BugSummaryKey key, int count) {

    public boolean fromJournal() {
        return id < 0;
    }
}
