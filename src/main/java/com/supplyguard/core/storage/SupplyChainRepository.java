package com.supplyguard.core.storage;

import com.supplyguard.core.model.Equipment;
import com.supplyguard.core.model.NewsCategory;
import com.supplyguard.core.model.NewsEvent;
import com.supplyguard.core.model.Schedule;

import java.util.List;
import java.util.Set;

/**
 * Read-only access to equipment, schedule and news-event records.
 * Implementations throw {@link StorageUnavailableException} when the backing store cannot be reached.
 */
public interface SupplyChainRepository {

    /** Equipment whose manufacturing or destination country and category match the filter. */
    List<Equipment> findEquipment(DataFilter filter);

    /** Schedules belonging to equipment that matches the filter. */
    List<Schedule> findSchedules(DataFilter filter);

    /** News events in any of {@code categories}, filtered by country and publication time. */
    List<NewsEvent> findNewsEvents(Set<NewsCategory> categories, DataFilter filter);
}
