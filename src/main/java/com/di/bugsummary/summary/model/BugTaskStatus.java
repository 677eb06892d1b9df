package com.di.bugsummary.summary.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Bug task status as stored in the {@code status} column of the summary tables.
 */
public enum BugTaskStatus {
    NEW(10),
    INCOMPLETE(15),
    OPINION(16),
    INVALID(17),
    WONTFIX(18),
    EXPIRED(19),
    CONFIRMED(20),
    TRIAGED(21),
    INPROGRESS(22),
    DEFERRED(23),
    FIXCOMMITTED(25),
    FIXRELEASED(30),
    UNKNOWN(999);

    /** Statuses counted as "open" by the tag count listings. */
    public static final Set<BugTaskStatus> UNRESOLVED = Collections.unmodifiableSet(
            EnumSet.of(NEW, INCOMPLETE, CONFIRMED, TRIAGED, INPROGRESS, FIXCOMMITTED));

    private final int value;

    BugTaskStatus(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    public static BugTaskStatus fromValue(int value) {
        return Arrays.stream(values())
                .filter(s -> s.value == value)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown bug task status value: " + value));
    }
}
