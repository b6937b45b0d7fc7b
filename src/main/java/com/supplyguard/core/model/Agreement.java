package com.supplyguard.core.model;

import java.util.Locale;

/**
 * How closely a set of scores for the same query agree with each other.
 */
public enum Agreement {
    FULL_AGREEMENT,
    PARTIAL_AGREEMENT,
    DISAGREEMENT;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
