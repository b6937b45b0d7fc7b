package com.supplyguard.core.routing;

import com.supplyguard.core.model.AgentRole;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Agent tiers to run in order; roles inside one tier run concurrently.
 * When {@code reporting} is set the reporting agent closes the pipeline.
 */
public record PipelinePlan(List<List<AgentRole>> tiers, boolean reporting) implements Serializable {

    public PipelinePlan {
        var copy = new ArrayList<List<AgentRole>>();
        if (tiers != null) {
            tiers.forEach(t -> copy.add(List.copyOf(t)));
        }
        tiers = List.copyOf(copy);
    }

    /** Flattened agent order, reporting last. */
    public List<AgentRole> sequence() {
        var roles = new ArrayList<AgentRole>();
        tiers.forEach(roles::addAll);
        if (reporting) {
            roles.add(AgentRole.REPORTING);
        }
        return List.copyOf(roles);
    }

    public int tierCount() {
        return tiers.size();
    }
}
