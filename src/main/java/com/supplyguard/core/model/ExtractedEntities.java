package com.supplyguard.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Entities pulled out of the query text: canonical country names, equipment
 * categories, and a time window in days when a date phrase was present.
 * {@code equipmentIds} only ever comes from caller context.
 */
public record ExtractedEntities(
    List<String> countries,
    List<String> equipmentCategories,
    Integer timeWindowDays,
    List<String> equipmentIds
) implements Serializable {

    public ExtractedEntities {
        countries = countries == null ? List.of() : List.copyOf(countries);
        equipmentCategories = equipmentCategories == null ? List.of() : List.copyOf(equipmentCategories);
        equipmentIds = equipmentIds == null ? List.of() : List.copyOf(equipmentIds);
    }

    public ExtractedEntities(List<String> countries, List<String> equipmentCategories, Integer timeWindowDays) {
        this(countries, equipmentCategories, timeWindowDays, List.of());
    }

    public static ExtractedEntities none() {
        return new ExtractedEntities(List.of(), List.of(), null);
    }
}
