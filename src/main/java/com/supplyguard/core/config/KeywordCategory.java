package com.supplyguard.core.config;

import com.supplyguard.core.model.RiskDimension;

/**
 * The weighted keyword categories scanned by keyword scoring.
 */
public enum KeywordCategory {
    POLITICAL(RiskDimension.POLITICAL),
    LOGISTICS(RiskDimension.LOGISTICS),
    TARIFF(RiskDimension.TARIFF),
    SCHEDULE(RiskDimension.SCHEDULING);

    private final RiskDimension dimension;

    KeywordCategory(RiskDimension dimension) {
        this.dimension = dimension;
    }

    public RiskDimension dimension() {
        return dimension;
    }
}
