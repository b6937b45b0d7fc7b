package com.supplyguard.core.model;

/**
 * Impact of a news event. {@code severity} is the raw weight used by
 * time-windowed scoring.
 */
public enum ImpactLevel {
    LOW(1),
    MEDIUM(3),
    HIGH(5);

    private final int severity;

    ImpactLevel(int severity) {
        this.severity = severity;
    }

    public int severity() {
        return severity;
    }
}
