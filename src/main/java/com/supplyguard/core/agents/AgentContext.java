package com.supplyguard.core.agents;

import com.supplyguard.core.model.AgentInvocation;
import com.supplyguard.core.model.Intent;
import com.supplyguard.core.model.Query;

import java.util.List;

/**
 * What an agent sees: the query, its classification, the invocations that
 * finished in earlier tiers, and whether the pipeline was cut short.
 */
public record AgentContext(
    String threadId,
    Query query,
    Intent intent,
    List<AgentInvocation> priorInvocations,
    boolean truncated
) {

    public AgentContext {
        priorInvocations = priorInvocations == null ? List.of() : List.copyOf(priorInvocations);
    }
}
