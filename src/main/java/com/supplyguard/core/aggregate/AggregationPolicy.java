package com.supplyguard.core.aggregate;

import com.supplyguard.core.model.RiskDimension;
import com.supplyguard.core.model.RiskScore;

import java.util.Map;

/**
 * Pure fold of per-dimension scores into one overall score.
 */
@FunctionalInterface
public interface AggregationPolicy {

    RiskScore aggregate(Map<RiskDimension, RiskScore> scores);
}
