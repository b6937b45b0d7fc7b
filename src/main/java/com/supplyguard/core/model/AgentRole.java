package com.supplyguard.core.model;

import java.util.Locale;

/**
 * Pipeline stage identities. {@code tier} orders roles inside a pipeline:
 * roles sharing a tier have no data dependency on each other.
 */
public enum AgentRole {
    SCHEDULER("SCHEDULER_AGENT", RiskDimension.SCHEDULING, 0),
    POLITICAL("POLITICAL_RISK_AGENT", RiskDimension.POLITICAL, 1),
    LOGISTICS("LOGISTICS_AGENT", RiskDimension.LOGISTICS, 1),
    TARIFF("TARIFF_AGENT", RiskDimension.TARIFF, 1),
    ASSISTANT("ASSISTANT_AGENT", RiskDimension.GENERAL, 0),
    REPORTING("REPORTING_AGENT", RiskDimension.OVERALL, 2);

    private final String agentName;
    private final RiskDimension dimension;
    private final int tier;

    AgentRole(String agentName, RiskDimension dimension, int tier) {
        this.agentName = agentName;
        this.dimension = dimension;
        this.tier = tier;
    }

    public String agentName() {
        return agentName;
    }

    public RiskDimension dimension() {
        return dimension;
    }

    public int tier() {
        return tier;
    }

    /**
     * Accepts the enum name ({@code political}) or the agent name
     * ({@code POLITICAL_RISK_AGENT}), in any case.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static AgentRole fromName(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Agent name must not be blank");
        }
        String key = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (var role : values()) {
            if (role.name().equals(key) || role.agentName.equals(key)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown agent: " + raw);
    }
}
