package com.supplyguard.core.llm;

import com.supplyguard.core.model.RiskScore;

import java.util.Optional;

/**
 * Outcome of one adapter call. Availability is a property of the result, so
 * concurrent threads never share an "AI is down" flag.
 */
public record AiCallResult(RiskScore score, String unavailableReason) {

    public static AiCallResult success(RiskScore score) {
        return new AiCallResult(score, null);
    }

    public static AiCallResult unavailable(String reason) {
        return new AiCallResult(null, reason == null ? "unknown" : reason);
    }

    public boolean isAvailable() {
        return score != null;
    }

    public Optional<RiskScore> scoreIfAvailable() {
        return Optional.ofNullable(score);
    }
}
