package com.supplyguard.core.routing;

import com.supplyguard.core.config.PipelineProperties;
import com.supplyguard.core.model.AgentRole;
import com.supplyguard.core.model.RiskDimension;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns ranked domains into a {@link PipelinePlan} using the configured
 * domain to agent-role routes. Adding a domain or agent is a configuration
 * change; nothing here branches on a specific domain.
 *
 * <p>Routes for all matched domains are merged in rank order, duplicates
 * dropped. Roles are then grouped into tiers by {@link AgentRole#tier()}, and
 * {@link AgentRole#REPORTING} is lifted out to close the pipeline.
 */
@Component
public class PipelineTable {

    private final Map<RiskDimension, List<AgentRole>> routes;

    public PipelineTable(PipelineProperties properties) {
        this.routes = properties.getRoutes();
    }

    public PipelinePlan planFor(List<RiskDimension> rankedDomains) {
        var merged = new LinkedHashSet<AgentRole>();
        if (rankedDomains != null) {
            for (var domain : rankedDomains) {
                merged.addAll(routes.getOrDefault(domain, List.of()));
            }
        }
        if (merged.isEmpty()) {
            merged.addAll(routes.getOrDefault(RiskDimension.GENERAL, List.of(AgentRole.ASSISTANT)));
        }

        boolean reporting = merged.remove(AgentRole.REPORTING);
        return planForAgents(new ArrayList<>(merged), reporting);
    }

    /**
     * Plan that runs exactly {@code roles}, grouped into tiers, bypassing the
     * configured routes. Used when the caller names the agents itself.
     */
    public PipelinePlan planForAgents(List<AgentRole> roles, boolean reporting) {
        var byTier = new TreeMap<Integer, List<AgentRole>>();
        for (var role : roles) {
            if (role != AgentRole.REPORTING && !byTier.getOrDefault(role.tier(), List.of()).contains(role)) {
                byTier.computeIfAbsent(role.tier(), k -> new ArrayList<>()).add(role);
            }
        }
        return new PipelinePlan(new ArrayList<>(byTier.values()), reporting);
    }
}
