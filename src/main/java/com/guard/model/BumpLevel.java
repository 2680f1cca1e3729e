package com.guard.model;

import java.util.Locale;

/**
 * Size of a version increment, ordered from smallest to largest.
 */
public enum BumpLevel {
    NONE,
    PATCH,
    MINOR,
    MAJOR;

    public boolean isSmallerThan(BumpLevel other) {
        return compareTo(other) < 0;
    }

    /**
     * The lower-case word used in report messages, e.g. {@code "minor"}.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
