package com.di.bugsummary.summary.journal;

import com.di.bugsummary.summary.model.BugSummaryKey;

/**
 * One pending delta. Ids increase in append order.
 */
public record JournalEntry(long id, BugSummaryKey key, int delta) {
}
