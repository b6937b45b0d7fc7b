package com.supplyguard.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A dimension-scoped risk verdict.
 *
 * <p>{@code score} is clamped to [0, 100] and {@code confidence} to [0, 1].
 * {@code details} keeps insertion order so that two runs over the same data
 * render identically. {@code agreement} is null unless an aggregation or an
 * AI/traditional comparison produced one.
 */
public record RiskScore(
    RiskDimension dimension,
    double score,
    RiskLevel level,
    String summary,
    List<String> recommendations,
    Provenance provenance,
    double confidence,
    Set<RiskCondition> conditions,
    Agreement agreement,
    Map<String, Object> details
) implements Serializable {

    public RiskScore {
        score = clamp(score, 0.0, 100.0);
        confidence = clamp(confidence, 0.0, 1.0);
        summary = summary == null ? "" : summary;
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        conditions = conditions == null || conditions.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(RiskCondition.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(conditions));
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static RiskScore of(RiskDimension dimension, double score, RiskLevel level, String summary) {
        return new RiskScore(dimension, score, level, summary, List.of(), Provenance.TRADITIONAL,
                0.8, Set.of(), null, Map.of());
    }

    /**
     * The zero-risk score strategies return when their input is empty.
     */
    public static RiskScore insufficientData(RiskDimension dimension, String what) {
        return new RiskScore(dimension, 0.0, RiskLevel.LOW, "Insufficient data: " + what,
                List.of(), Provenance.TRADITIONAL, 0.0, Set.of(RiskCondition.INSUFFICIENT_DATA), null,
                Map.of("note", "insufficient data: " + what));
    }

    public boolean hasCondition(RiskCondition condition) {
        return conditions.contains(condition);
    }

    public RiskScore withRecommendations(List<String> recommendations) {
        return new RiskScore(dimension, score, level, summary, recommendations, provenance, confidence,
                conditions, agreement, details);
    }

    public RiskScore withProvenance(Provenance provenance) {
        return new RiskScore(dimension, score, level, summary, recommendations, provenance, confidence,
                conditions, agreement, details);
    }

    public RiskScore withConfidence(double confidence) {
        return new RiskScore(dimension, score, level, summary, recommendations, provenance, confidence,
                conditions, agreement, details);
    }

    public RiskScore withSummary(String summary) {
        return new RiskScore(dimension, score, level, summary, recommendations, provenance, confidence,
                conditions, agreement, details);
    }

    public RiskScore withAgreement(Agreement agreement) {
        return new RiskScore(dimension, score, level, summary, recommendations, provenance, confidence,
                conditions, agreement, details);
    }

    public RiskScore withCondition(RiskCondition condition) {
        var merged = EnumSet.noneOf(RiskCondition.class);
        merged.addAll(conditions);
        merged.add(condition);
        return new RiskScore(dimension, score, level, summary, recommendations, provenance, confidence,
                merged, agreement, details);
    }

    public RiskScore withDetail(String key, Object value) {
        var merged = new LinkedHashMap<>(details);
        merged.put(key, value);
        return new RiskScore(dimension, score, level, summary, recommendations, provenance, confidence,
                conditions, agreement, merged);
    }

    public RiskScore withDetails(Map<String, ?> extra) {
        var merged = new LinkedHashMap<String, Object>(details);
        merged.putAll(extra);
        return new RiskScore(dimension, score, level, summary, recommendations, provenance, confidence,
                conditions, agreement, merged);
    }

    /** Condition names in declaration order, as rendered under {@code details.conditions}. */
    public List<String> conditionNames() {
        var names = new ArrayList<String>();
        for (var c : conditions) {
            names.add(c.wireName());
        }
        return names;
    }

    private static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }
}
