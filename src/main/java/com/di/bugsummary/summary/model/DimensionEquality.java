package com.di.bugsummary.summary.model;

/**
 * Equality for bucket dimensions with SQL {@code IS NOT DISTINCT FROM} semantics:
 * NULL is a value of its own and equals only NULL.
 *
 * <p>Both bucket lookup and bucket creation go through this helper so that the in-memory
 * stores and the {@code IS NOT DISTINCT FROM} predicates in {@code sql-queries.yml} agree.
 */
public final class DimensionEquality {

    private DimensionEquality() {
    }

    public static boolean isNotDistinctFrom(Object a, Object b) {
        if (a == null) {
            return b == null;
        }
        if (b == null) {
            return false;
        }
        return a.equals(b);
    }

    public static boolean isDistinctFrom(Object a, Object b) {
        return !isNotDistinctFrom(a, b);
    }
}
