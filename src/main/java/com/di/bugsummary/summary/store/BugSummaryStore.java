package com.di.bugsummary.summary.store;

import com.di.bugsummary.exception.SummaryCorruptionException;
import com.di.bugsummary.summary.model.BugSummaryKey;
import com.di.bugsummary.summary.view.BugSummaryFilter;
import org.springframework.dao.DuplicateKeyException;

import java.util.List;
import java.util.OptionalInt;

/**
 * Row-level access to the aggregate table. Every operation identifies its row by whole-key
 * equality with NULL equal to NULL.
 */
public interface BugSummaryStore {

    /**
     * Adds {@code delta} to the row for {@code key} in place.
     *
     * @return number of rows updated: 0 when no row exists, otherwise 1
     * @throws SummaryCorruptionException if the count would overflow
     */
    int increment(BugSummaryKey key, int delta);

    /**
     * Creates the row for {@code key}.
     *
     * @throws DuplicateKeyException if a row for the key already exists
     */
    void insert(BugSummaryKey key, int count);

    OptionalInt findCount(BugSummaryKey key);

    /** Deletes the row for {@code key} if its count is exactly zero. */
    int deleteIfZero(BugSummaryKey key);

    /**
     * Takes the rollup lock for the current transaction. Held until commit or rollback; does not
     * block writers of the journal.
     */
    void lockForRollup();

    List<BugSummaryRow> findAll(BugSummaryFilter filter);

    /** Rows whose count is zero or negative. Empty when the table is consistent. */
    List<BugSummaryRow> findNonPositive();
}
