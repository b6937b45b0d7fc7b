package com.supplyguard.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Classification of a query: ranked domains (strongest first), the raw match
 * strength per domain, extracted entities, a confidence in [0, 1], and the
 * agent sequence the pipeline table derives from the domains.
 */
public record Intent(
    List<RiskDimension> domains,
    Map<RiskDimension, Integer> matchStrength,
    ExtractedEntities entities,
    double confidence,
    List<AgentRole> agentSequence
) implements Serializable {

    public Intent {
        domains = domains == null ? List.of() : List.copyOf(domains);
        matchStrength = matchStrength == null ? Map.of() : Map.copyOf(matchStrength);
        entities = entities == null ? ExtractedEntities.none() : entities;
        agentSequence = agentSequence == null ? List.of() : List.copyOf(agentSequence);
    }

    public RiskDimension primaryDomain() {
        return domains.isEmpty() ? RiskDimension.GENERAL : domains.get(0);
    }

    /**
     * Same entities, routed to {@code domains} by the caller rather than by
     * keyword match, so confidence is full.
     */
    public Intent routedTo(List<RiskDimension> domains, List<AgentRole> agentSequence) {
        return new Intent(domains, matchStrength, entities, 1.0, agentSequence);
    }

    public boolean isGeneral() {
        return primaryDomain() == RiskDimension.GENERAL;
    }
}
