package com.supplyguard.core.agents;

import com.supplyguard.core.model.AgentRole;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up the agent bound to each {@link AgentRole}.
 */
@Component
public class AgentRegistry {

    private final Map<AgentRole, RiskAgent> agents = new EnumMap<>(AgentRole.class);

    public AgentRegistry(List<RiskAgent> agents) {
        for (RiskAgent agent : agents) {
            var previous = this.agents.put(agent.role(), agent);
            if (previous != null) {
                throw new IllegalStateException("Two agents registered for role " + agent.role()
                        + ": " + previous.getClass().getSimpleName() + " and " + agent.getClass().getSimpleName());
            }
        }
    }

    /**
     * @throws IllegalArgumentException if no agent is registered for {@code role}
     */
    public RiskAgent agent(AgentRole role) {
        var agent = agents.get(role);
        if (agent == null) {
            throw new IllegalArgumentException("No agent registered for role " + role);
        }
        return agent;
    }

    public boolean has(AgentRole role) {
        return agents.containsKey(role);
    }

    /** In {@link AgentRole} declaration order. */
    public List<AgentCapability> capabilities() {
        var list = new ArrayList<AgentCapability>();
        agents.values().forEach(a -> list.add(a.capability()));
        return list;
    }
}
