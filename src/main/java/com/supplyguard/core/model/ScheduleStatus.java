package com.supplyguard.core.model;

public enum ScheduleStatus {
    PLANNED,
    IN_PROGRESS,
    DELAYED,
    COMPLETED
}
