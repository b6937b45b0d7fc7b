package com.supplyguard.core.model;

import java.util.Locale;

/**
 * Discretized risk level, ordered from least to most severe.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isAdjacentTo(RiskLevel other) {
        return Math.abs(ordinal() - other.ordinal()) == 1;
    }

    /** Returns the more severe of the two levels. */
    public static RiskLevel max(RiskLevel a, RiskLevel b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }

    public static RiskLevel fromWireName(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Risk level must not be blank");
        }
        return RiskLevel.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
