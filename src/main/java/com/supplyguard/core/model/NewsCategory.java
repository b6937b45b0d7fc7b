package com.supplyguard.core.model;

public enum NewsCategory {
    POLITICAL,
    ECONOMIC,
    LOGISTICS,
    NATURAL_DISASTER,
    TARIFF
}
