package com.di.bugsummary.summary.model;

import lombok.Builder;
import lombok.Getter;

import java.util.Objects;

/**
 * Identity of one summary bucket.
 *
 * <p>Two keys are equal when every dimension is equal with NULL treated as a value
 * ({@link DimensionEquality#isNotDistinctFrom}). {@link #canonical()} gives the same identity as a
 * string, stored in the unique {@code dimension_key} column so the database enforces at most one
 * aggregate row per key even though its nullable columns cannot be covered by a plain unique index.
 */
@Getter
public final class BugSummaryKey {

    private final BugTarget target;
    private final Long viewedBy;
    private final Long accessPolicy;
    private final String tag;
    private final BugTaskStatus status;
    private final Long milestone;
    private final BugTaskImportance importance;
    private final boolean hasPatch;

    @Builder(toBuilder = true)
    private BugSummaryKey(BugTarget target, Long viewedBy, Long accessPolicy, String tag,
                          BugTaskStatus status, Long milestone, BugTaskImportance importance, boolean hasPatch) {
        this.target = Objects.requireNonNull(target, "target");
        this.viewedBy = viewedBy;
        this.accessPolicy = accessPolicy;
        this.tag = tag;
        this.status = Objects.requireNonNull(status, "status");
        this.milestone = milestone;
        this.importance = Objects.requireNonNull(importance, "importance");
        this.hasPatch = hasPatch;
    }

    public BugSummaryKey withTarget(BugTarget newTarget) {
        return toBuilder().target(newTarget).build();
    }

    public BugSummaryKey withViewer(Viewer viewer) {
        return toBuilder().viewedBy(viewer.viewedBy()).accessPolicy(viewer.accessPolicy()).build();
    }

    public BugSummaryKey withTag(String newTag) {
        return toBuilder().tag(newTag).build();
    }

    public Viewer viewer() {
        return new Viewer(viewedBy, accessPolicy);
    }

    /**
     * Unambiguous string form of the key: each dimension is {@code ~} when NULL, otherwise its
     * value prefixed by its length.
     */
    public String canonical() {
        StringBuilder sb = new StringBuilder(96);
        for (BugSummaryDimension dimension : BugSummaryDimension.values()) {
            if (sb.length() > 0) {
                sb.append('|');
            }
            Object value = dimension.valueOf(this);
            if (value == null) {
                sb.append('~');
            } else {
                String text = String.valueOf(value);
                sb.append(text.length()).append(':').append(text);
            }
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BugSummaryKey other)) return false;
        for (BugSummaryDimension dimension : BugSummaryDimension.values()) {
            if (DimensionEquality.isDistinctFrom(dimension.valueOf(this), dimension.valueOf(other))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = 1;
        for (BugSummaryDimension dimension : BugSummaryDimension.values()) {
            h = 31 * h + Objects.hashCode(dimension.valueOf(this));
        }
        return h;
    }

    @Override
    public String toString() {
        return "BugSummaryKey[" + canonical() + "]";
    }
}
