package com.supplyguard.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a conversation thread.
 * <pre>
 *   STARTED -> ROUTING -> RUNNING (per tier) -> REPORTING -> CLOSED
 *                              \-> CLOSED (assistant-only pipelines)
 *   any non-terminal state -> FAILED
 * </pre>
 */
public enum ThreadStatus {
    STARTED,
    ROUTING,
    RUNNING,
    REPORTING,
    CLOSED,
    FAILED;

    public boolean isTerminal() {
        return this == CLOSED || this == FAILED;
    }

    public boolean canTransitionTo(ThreadStatus next) {
        return allowedNext().contains(next);
    }

    private Set<ThreadStatus> allowedNext() {
        return switch (this) {
            case STARTED -> EnumSet.of(ROUTING, FAILED);
            case ROUTING -> EnumSet.of(RUNNING, FAILED);
            case RUNNING -> EnumSet.of(RUNNING, REPORTING, CLOSED, FAILED);
            case REPORTING -> EnumSet.of(CLOSED, FAILED);
            case CLOSED, FAILED -> EnumSet.noneOf(ThreadStatus.class);
        };
    }
}
