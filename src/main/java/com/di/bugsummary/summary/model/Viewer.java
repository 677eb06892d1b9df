package com.di.bugsummary.summary.model;

/**
 * Visibility pair of a bucket. {@code (null, null)} is the public copy, {@code (person, null)}
 * a per-grantee copy and {@code (null, policy)} the per-policy copy of a private bug.
 */
public record Viewer(Long viewedBy, Long accessPolicy) {

    public static final Viewer PUBLIC = new Viewer(null, null);

    public static Viewer grantee(long person) {
        return new Viewer(person, null);
    }

    public static Viewer policy(long policy) {
        return new Viewer(null, policy);
    }
}
