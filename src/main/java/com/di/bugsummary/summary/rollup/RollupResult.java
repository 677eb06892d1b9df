package com.di.bugsummary.summary.rollup;

/**
 * Outcome of one rollup batch.
 *
 * @param highWaterMark   largest journal id folded, -1 when the journal was empty
 * @param entriesRead     journal entries read at or below the mark
 * @param buckets         distinct keys among those entries
 * @param bucketsApplied  keys whose net delta was written to the aggregate table
 * @param bucketsCancelled keys whose entries summed to zero, so nothing was written
 * @param bucketsDeferred keys whose apply failed and whose net delta was journaled again
 */
public record RollupResult(long highWaterMark, int entriesRead, int buckets,
                           int bucketsApplied, int bucketsCancelled, int bucketsDeferred) {

    private static final RollupResult EMPTY = new RollupResult(-1L, 0, 0, 0, 0, 0);

    public static RollupResult empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return entriesRead == 0;
    }

    public boolean hasDeferred() {
        return bucketsDeferred > 0;
    }
}
