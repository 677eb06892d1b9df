package com.di.bugsummary.summary.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Signed change to the count of one bucket.
 */
public record BugSummaryDelta(BugSummaryKey key, int delta) {

    public BugSummaryDelta {
        Objects.requireNonNull(key, "key");
    }

    public static BugSummaryDelta plus(BugSummaryKey key) {
        return new BugSummaryDelta(key, 1);
    }

    public static BugSummaryDelta minus(BugSummaryKey key) {
        return new BugSummaryDelta(key, -1);
    }

    /**
     * Sums deltas per key, keeping first-seen order, and drops keys whose sum is zero.
     */
    public static List<BugSummaryDelta> net(Collection<BugSummaryDelta> deltas) {
        Map<BugSummaryKey, Integer> sums = new LinkedHashMap<>();
        for (BugSummaryDelta d : deltas) {
            sums.merge(d.key(), d.delta(), Math::addExact);
        }
        List<BugSummaryDelta> out = new ArrayList<>(sums.size());
        sums.forEach((key, sum) -> {
            if (sum != 0) {
                out.add(new BugSummaryDelta(key, sum));
            }
        });
        return out;
    }
}
