package com.supplyguard.core.model;

import java.io.Serializable;
import java.util.Map;

/**
 * One execution of one agent inside one conversation thread.
 *
 * <p>{@code score} is always present: failed and timed-out invocations carry a
 * zero-confidence fallback score, and {@code error} explains why.
 */
public record AgentInvocation(
    AgentRole role,
    int tier,
    Map<String, Object> input,
    InvocationStatus status,
    RiskScore score,
    String error,
    long elapsedMs
) implements Serializable {

    public AgentInvocation {
        input = input == null ? Map.of() : Map.copyOf(input);
    }

    public RiskDimension dimension() {
        return score != null ? score.dimension() : role.dimension();
    }

    public boolean succeeded() {
        return status == InvocationStatus.SUCCEEDED;
    }
}
