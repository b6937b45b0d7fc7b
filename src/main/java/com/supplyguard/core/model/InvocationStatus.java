package com.supplyguard.core.model;

/**
 * Status of a single agent execution within a pipeline.
 */
public enum InvocationStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    TIMED_OUT
}
