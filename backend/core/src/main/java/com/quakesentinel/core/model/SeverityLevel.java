package com.quakesentinel.core.model;

/**
 * Ordered from least to most severe; ordinal comparison is meaningful.
 */
public enum SeverityLevel {
    NONE,
    WATCH,
    ALERT,
    WARNING,
    MAJOR,
    EMERGENCY;

    public boolean isAtLeast(SeverityLevel other) {
        return compareTo(other) >= 0;
    }

    public boolean isActive() {
        return this != NONE;
    }
}
