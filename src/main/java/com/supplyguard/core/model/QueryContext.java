package com.supplyguard.core.model;

import java.io.Serializable;

/**
 * Optional structured hints supplied alongside the query text.
 * Any field may be null.
 * <p>
 * {@code counterpartCountry} names the other end of a route or trade
 * relationship whose first end is {@code country}. {@code equipmentId}
 * narrows equipment and schedule reads to one unit.
 */
public record QueryContext(
    String country,
    String equipmentType,
    Integer timeWindowDays,
    String counterpartCountry,
    String equipmentId
) implements Serializable {

    public QueryContext(String country, String equipmentType, Integer timeWindowDays) {
        this(country, equipmentType, timeWindowDays, null, null);
    }

    public static QueryContext empty() {
        return new QueryContext(null, null, null);
    }

    public boolean isEmpty() {
        return isBlank(country) && isBlank(equipmentType) && timeWindowDays == null
                && isBlank(counterpartCountry) && isBlank(equipmentId);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
