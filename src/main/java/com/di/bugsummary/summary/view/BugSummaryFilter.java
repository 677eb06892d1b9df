package com.di.bugsummary.summary.view;

import com.di.bugsummary.summary.model.BugSummaryDimension;
import com.di.bugsummary.summary.model.BugSummaryKey;
import com.di.bugsummary.summary.model.BugTaskStatus;
import com.di.bugsummary.summary.model.DimensionEquality;

import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Row filter over summary buckets, evaluated in memory by {@link #matches} and rendered to SQL by
 * {@link BugSummaryFilterSql}.
 *
 * <p>Per dimension a filter holds either a list of allowed values (a {@code null} element matches
 * SQL NULL) or a NOT NULL constraint. Values are kept in their JDBC form: enum constants become
 * their stored int and numbers on id columns become longs.
 *
 * <p>An optional {@link Visibility} restricts private rows to what one reader may see.
 */
public final class BugSummaryFilter {

    public static final BugSummaryFilter ALL = builder().build();

    private final Map<BugSummaryDimension, List<Object>> allowed;
    private final Set<BugSummaryDimension> notNull;
    private final Visibility visibility;

    private BugSummaryFilter(Builder b) {
        EnumMap<BugSummaryDimension, List<Object>> copy = new EnumMap<>(BugSummaryDimension.class);
        b.allowed.forEach((d, values) -> copy.put(d, Collections.unmodifiableList(new ArrayList<>(values))));
        this.allowed = Collections.unmodifiableMap(copy);
        this.notNull = Collections.unmodifiableSet(b.notNull.isEmpty()
                ? EnumSet.noneOf(BugSummaryDimension.class) : EnumSet.copyOf(b.notNull));
        this.visibility = b.visibility;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        allowed.forEach((d, values) -> b.allowed.put(d, new ArrayList<>(values)));
        b.notNull.addAll(notNull);
        b.visibility = visibility;
        return b;
    }

    public Map<BugSummaryDimension, List<Object>> getAllowed() {
        return allowed;
    }

    public Set<BugSummaryDimension> getNotNull() {
        return notNull;
    }

    public Visibility getVisibility() {
        return visibility;
    }

    public boolean isUnrestricted() {
        return allowed.isEmpty() && notNull.isEmpty() && visibility == null;
    }

    public boolean matches(BugSummaryKey key) {
        for (Map.Entry<BugSummaryDimension, List<Object>> e : allowed.entrySet()) {
            Object actual = e.getKey().valueOf(key);
            boolean any = false;
            for (Object candidate : e.getValue()) {
                if (DimensionEquality.isNotDistinctFrom(actual, candidate)) {
                    any = true;
                    break;
                }
            }
            if (!any) {
                return false;
            }
        }
        for (BugSummaryDimension d : notNull) {
            if (d.valueOf(key) == null) {
                return false;
            }
        }
        return visibility == null || visibility.matches(key.getViewedBy(), key.getAccessPolicy());
    }

    @Override
    public String toString() {
        return "BugSummaryFilter{allowed=" + allowed + ", notNull=" + notNull + ", visibility=" + visibility + "}";
    }

    /**
     * Who is reading. Public rows always match. A row for a grantee matches that grantee's
     * {@code userId}; a per-policy row matches when its policy is in {@code policies}.
     */
    public record Visibility(Long userId, Set<Long> policies) {

        public Visibility {
            policies = policies == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(policies));
        }

        public boolean matches(Long viewedBy, Long accessPolicy) {
            if (viewedBy == null && accessPolicy == null) {
                return true;
            }
            if (viewedBy != null) {
                return viewedBy.equals(userId);
            }
            return policies.contains(accessPolicy);
        }
    }

    public static final class Builder {
        private final Map<BugSummaryDimension, List<Object>> allowed = new EnumMap<>(BugSummaryDimension.class);
        private final Set<BugSummaryDimension> notNull = EnumSet.noneOf(BugSummaryDimension.class);
        private Visibility visibility;

        private Builder() {
        }

        /** Dimension equals {@code value}; a null value means IS NULL. */
        public Builder where(BugSummaryDimension dimension, Object value) {
            List<Object> values = new ArrayList<>(1);
            values.add(normalize(dimension, value));
            allowed.put(dimension, values);
            notNull.remove(dimension);
            return this;
        }

        /** Dimension is one of {@code values}; a null element also admits NULL. */
        public Builder whereIn(BugSummaryDimension dimension, Collection<?> values) {
            if (values == null || values.isEmpty()) {
                throw new IllegalArgumentException("No values given for " + dimension);
            }
            List<Object> normalized = new ArrayList<>(values.size());
            for (Object v : values) {
                normalized.add(normalize(dimension, v));
            }
            allowed.put(dimension, normalized);
            notNull.remove(dimension);
            return this;
        }

        public Builder whereNotNull(BugSummaryDimension dimension) {
            allowed.remove(dimension);
            notNull.add(dimension);
            return this;
        }

        public Builder statuses(Collection<BugTaskStatus> statuses) {
            return whereIn(BugSummaryDimension.STATUS, statuses);
        }

        public Builder visibleTo(long userId) {
            this.visibility = new Visibility(userId, Set.of());
            return this;
        }

        public Builder visibleThroughPolicies(Collection<Long> policies) {
            this.visibility = new Visibility(null, policies == null ? Set.of() : Set.copyOf(policies));
            return this;
        }

        public Builder publicOnly() {
            this.visibility = new Visibility(null, Set.of());
            return this;
        }

        public BugSummaryFilter build() {
            return new BugSummaryFilter(this);
        }

        private static Object normalize(BugSummaryDimension dimension, Object value) {
            Object jdbc = BugSummaryDimension.toJdbc(value);
            if (jdbc instanceof Number n && dimension.getSqlType() == Types.BIGINT) {
                return n.longValue();
            }
            if (jdbc instanceof Number n && dimension.getSqlType() == Types.INTEGER) {
                return n.intValue();
            }
            return jdbc;
        }
    }
}
