package com.di.bugsummary.summary.model;

import java.util.Arrays;

public enum BugTaskImportance {
    UNKNOWN(999),
    UNDECIDED(5),
    WISHLIST(10),
    LOW(20),
    MEDIUM(30),
    HIGH(40),
    CRITICAL(50);

    private final int value;

    BugTaskImportance(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    public static BugTaskImportance fromValue(int value) {
        return Arrays.stream(values())
                .filter(i -> i.value == value)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown bug task importance value: " + value));
    }
}
