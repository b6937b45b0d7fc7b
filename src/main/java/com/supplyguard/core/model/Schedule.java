package com.supplyguard.core.model;

import java.io.Serializable;
import java.time.LocalDate;

/**
 * Manufacturing/delivery schedule for one piece of equipment.
 * Actual dates are null until the corresponding milestone happens.
 */
public record Schedule(
    String id,
    String equipmentId,
    LocalDate plannedStart,
    LocalDate plannedEnd,
    LocalDate actualStart,
    LocalDate actualEnd,
    ScheduleStatus status,
    int delayDays,
    RiskLevel riskLevel
) implements Serializable {

    public boolean isDelayed() {
        return status == ScheduleStatus.DELAYED || delayDays > 0;
    }

    public boolean isOpen() {
        return status != ScheduleStatus.COMPLETED;
    }

    /** Delayed, or still open past its planned end date. */
    public boolean isOverdue(LocalDate reference) {
        return isDelayed() || (isOpen() && plannedEnd != null && plannedEnd.isBefore(reference));
    }
}
