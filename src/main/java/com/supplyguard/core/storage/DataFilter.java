package com.supplyguard.core.storage;

import java.time.Instant;
import java.util.List;

/**
 * Read filter. Empty lists and a null {@code since} mean "no restriction".
 * Countries are compared case-insensitively; equipment categories match as substrings;
 * equipment ids match exactly.
 */
public record DataFilter(List<String> countries, List<String> equipmentCategories, Instant since,
                         List<String> equipmentIds) {

    public DataFilter {
        countries = countries == null ? List.of() : List.copyOf(countries);
        equipmentCategories = equipmentCategories == null ? List.of() : List.copyOf(equipmentCategories);
        equipmentIds = equipmentIds == null ? List.of() : List.copyOf(equipmentIds);
    }

    public DataFilter(List<String> countries, List<String> equipmentCategories, Instant since) {
        this(countries, equipmentCategories, since, List.of());
    }

    public static DataFilter all() {
        return new DataFilter(List.of(), List.of(), null);
    }

    public DataFilter withSince(Instant since) {
        return new DataFilter(countries, equipmentCategories, since, equipmentIds);
    }
}
