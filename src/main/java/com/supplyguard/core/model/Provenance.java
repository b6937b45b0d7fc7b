package com.supplyguard.core.model;

/**
 * Where a {@link RiskScore} came from.
 */
public enum Provenance {
    TRADITIONAL("traditional"),
    AI("ai"),
    TRADITIONAL_FALLBACK("traditional-fallback"),
    BLENDED("blended");

    private final String wireName;

    Provenance(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
