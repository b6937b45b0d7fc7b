package com.supplyguard.core.agents;

import java.util.List;

/**
 * Self-description of an agent, listed by the {@code agents} command and the capabilities endpoint.
 */
public record AgentCapability(
    String role,
    String agentName,
    String description,
    List<String> capabilities,
    List<String> exampleQueries
) {}
