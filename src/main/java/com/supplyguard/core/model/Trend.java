package com.supplyguard.core.model;

import java.util.Locale;

public enum Trend {
    INCREASING,
    DECREASING,
    STABLE;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
