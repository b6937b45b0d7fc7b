package com.supplyguard.core.agents;

import com.supplyguard.core.model.AgentRole;
import com.supplyguard.core.model.RiskScore;

/**
 * A pipeline stage producing one {@link RiskScore}.
 * <p>
 * Implementations may throw {@link com.supplyguard.core.storage.StorageUnavailableException},
 * which fails the whole thread; any other exception is recorded as a failed
 * invocation and the pipeline continues.
 */
public interface RiskAgent {

    AgentRole role();

    AgentCapability capability();

    RiskScore analyze(AgentContext context);
}
