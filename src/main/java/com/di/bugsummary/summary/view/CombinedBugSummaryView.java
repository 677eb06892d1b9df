package com.di.bugsummary.summary.view;

import java.util.stream.Stream;

/**
 * Union of the aggregate table and the journal. Readers sum {@link CombinedSummaryRow#count()} per
 * key to see every delta, folded or not.
 */
public interface CombinedBugSummaryView {

    Stream<CombinedSummaryRow> query(BugSummaryFilter filter);
}
