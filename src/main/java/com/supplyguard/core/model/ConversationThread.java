package com.supplyguard.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Sealed record of one query's pipeline run. Never mutated after the engine
 * returns it; the final score is derivable from {@code invocations}.
 */
public record ConversationThread(
    String threadId,
    Query query,
    Intent intent,
    List<AgentInvocation> invocations,
    RiskScore finalScore,
    ThreadStatus status,
    boolean truncated,
    List<String> transitions,
    Instant startedAt,
    Instant closedAt
) implements Serializable {

    public ConversationThread {
        invocations = invocations == null ? List.of() : List.copyOf(invocations);
        transitions = transitions == null ? List.of() : List.copyOf(transitions);
    }

    public List<AgentRole> pipeline() {
        return invocations.stream().map(AgentInvocation::role).toList();
    }
}
