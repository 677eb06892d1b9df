package com.di.bugsummary.summary.journal;

import com.di.bugsummary.summary.model.BugSummaryDelta;
import com.di.bugsummary.summary.view.BugSummaryFilter;

import java.util.Collection;
import java.util.List;
import java.util.OptionalLong;

/**
 * Append-only buffer of bucket deltas waiting to be folded into the aggregate table.
 *
 * <p>Appends never read or lock the aggregate table, so concurrent fact writers only contend on
 * the journal's id sequence.
 */
public interface BugSummaryJournal {

    /**
     * Sums the deltas per key, drops zero nets and writes the rest.
     *
     * @return number of entries written
     */
    int append(List<BugSummaryDelta> deltas);

    /**
     * Largest id among the first {@code batchSize} entries, or among all entries when
     * {@code batchSize} is null. Empty when the journal is empty.
     */
    OptionalLong highWaterMark(Integer batchSize);

    /** Entries with id at most {@code mark}, in id order. */
    List<JournalEntry> readUpTo(long mark);

    /**
     * Deletes exactly the given entries. An entry that committed with a lower id after the read
     * is left for the next rollup.
     *
     * @return number of entries deleted
     */
    int delete(Collection<Long> ids);

    long size();

    default boolean isEmpty() {
        return size() == 0;
    }

    List<JournalEntry> findAll(BugSummaryFilter filter);
}
