package com.supplyguard.core.model;

import java.util.Locale;

/**
 * Named risk axis. The first five values double as the domains an intent can carry;
 * {@link #OVERALL} tags the aggregated verdict.
 */
public enum RiskDimension {
    SCHEDULING,
    POLITICAL,
    LOGISTICS,
    TARIFF,
    GENERAL,
    OVERALL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
