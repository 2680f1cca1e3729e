package com.guard.model;

/**
 * How much a violation is expected to hurt existing clients, ordered from least to most severe.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH;

    /**
     * The next level up, or {@code HIGH} when already at the top.
     */
    public Severity raised() {
        return this == LOW ? MEDIUM : HIGH;
    }
}
