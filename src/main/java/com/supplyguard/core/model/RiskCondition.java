package com.supplyguard.core.model;

import java.util.Locale;

/**
 * Degradation markers carried on a {@link RiskScore} so callers can tell
 * "no risk" apart from "could not assess".
 */
public enum RiskCondition {
    INSUFFICIENT_DATA,
    UNKNOWN_ENTITY,
    AI_UNAVAILABLE,
    FREE_TEXT_RESPONSE,
    AGENT_FAILURE,
    AGENT_TIMEOUT,
    PIPELINE_TRUNCATED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
