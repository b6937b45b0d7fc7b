package com.supplyguard.core.aggregate;

import com.supplyguard.core.config.DisagreementPolicy;
import com.supplyguard.core.config.RiskProperties;
import com.supplyguard.core.model.Agreement;
import com.supplyguard.core.model.Provenance;
import com.supplyguard.core.model.RiskCondition;
import com.supplyguard.core.model.RiskDimension;
import com.supplyguard.core.model.RiskLevel;
import com.supplyguard.core.model.RiskScore;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Weighted-average aggregation with an agreement annotation.
 *
 * <p>The overall level is looked up from the averaged score using the shared
 * bands. It is deliberately not the maximum of the input levels, which is the
 * rule {@link com.supplyguard.core.strategy.ThresholdStrategy} applies inside
 * a single dimension.
 */
@Component
public class RiskAggregator implements AggregationPolicy {

    private final RiskProperties properties;

    public RiskAggregator(RiskProperties properties) {
        this.properties = properties;
    }

    @Override
    public RiskScore aggregate(Map<RiskDimension, RiskScore> scores) {
        if (scores == null || scores.isEmpty()) {
            return RiskScore.insufficientData(RiskDimension.OVERALL, "no dimension scores to aggregate");
        }

        double weightedSum = 0.0;
        double confidenceSum = 0.0;
        double weightTotal = 0.0;
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        var conditions = EnumSet.noneOf(RiskCondition.class);
        var provenances = EnumSet.noneOf(Provenance.class);
        var levels = EnumSet.noneOf(RiskLevel.class);
        var perDimension = new LinkedHashMap<String, Object>();

        for (var entry : scores.entrySet()) {
            var s = entry.getValue();
            double w = Math.max(0.0, properties.weightFor(entry.getKey()));
            weightedSum += w * s.score();
            confidenceSum += w * s.confidence();
            weightTotal += w;
            min = Math.min(min, s.score());
            max = Math.max(max, s.score());
            conditions.addAll(s.conditions());
            provenances.add(s.provenance());
            levels.add(s.level());
            perDimension.put(entry.getKey().wireName(), s.score());
        }

        double score;
        double confidence;
        if (weightTotal > 0.0) {
            score = weightedSum / weightTotal;
            confidence = confidenceSum / weightTotal;
        } else {
            // every configured weight is zero: fall back to equal weights
            score = scores.values().stream().mapToDouble(RiskScore::score).average().orElse(0.0);
            confidence = scores.values().stream().mapToDouble(RiskScore::confidence).average().orElse(0.0);
        }

        double spread = max - min;
        Agreement agreement;
        if (spread > properties.getDivergenceThreshold()) {
            agreement = Agreement.DISAGREEMENT;
        } else if (levels.size() == 1) {
            agreement = Agreement.FULL_AGREEMENT;
        } else {
            agreement = Agreement.PARTIAL_AGREEMENT;
        }

        RiskLevel level = properties.getLevels().levelFor(score);
        var details = new LinkedHashMap<String, Object>();
        details.put("dimension_scores", perDimension);
        details.put("score_spread", spread);

        var dimensionNames = new ArrayList<String>();
        scores.keySet().forEach(d -> dimensionNames.add(d.wireName()));
        String summary = String.format("Overall %s risk (%.1f) across %s",
                level.wireName(), score, String.join(", ", dimensionNames));
        Provenance provenance = provenances.size() == 1 ? provenances.iterator().next() : Provenance.BLENDED;

        return new RiskScore(RiskDimension.OVERALL, score, level, summary, List.of(), provenance, confidence,
                conditions, agreement, details);
    }

    /**
     * Agreement between two scores for the same question: same level is full
     * agreement, adjacent levels within the divergence threshold are partial,
     * anything else is disagreement.
     */
    public Agreement compare(RiskScore a, RiskScore b) {
        if (Math.abs(a.score() - b.score()) > properties.getDivergenceThreshold()) {
            return Agreement.DISAGREEMENT;
        }
        if (a.level() == b.level()) {
            return Agreement.FULL_AGREEMENT;
        }
        return a.level().isAdjacentTo(b.level()) ? Agreement.PARTIAL_AGREEMENT : Agreement.DISAGREEMENT;
    }

    /**
     * Chooses between an AI-derived and a traditional score for one dimension.
     * While they agree at least partially the AI score stands; on disagreement
     * the configured {@link DisagreementPolicy} decides.
     */
    public RiskScore reconcile(RiskScore ai, RiskScore traditional) {
        Agreement agreement = compare(ai, traditional);
        var comparison = new LinkedHashMap<String, Object>();
        comparison.put("ai_score", ai.score());
        comparison.put("traditional_score", traditional.score());
        comparison.put("agreement", agreement.wireName());

        if (agreement != Agreement.DISAGREEMENT) {
            return ai.withAgreement(agreement).withDetail("comparison", comparison);
        }
        DisagreementPolicy policy = properties.getDisagreementPolicy();
        comparison.put("policy", policy.name().toLowerCase(Locale.ROOT));
        return switch (policy) {
            case PREFER_AI -> ai.withAgreement(agreement).withDetail("comparison", comparison);
            case PREFER_TRADITIONAL -> traditional.withAgreement(agreement).withDetail("comparison", comparison);
            case BLEND -> blend(ai, traditional, agreement).withDetail("comparison", comparison);
        };
    }

    private RiskScore blend(RiskScore ai, RiskScore traditional, Agreement agreement) {
        double score = (ai.score() + traditional.score()) / 2.0;
        var recommendations = new ArrayList<>(ai.recommendations());
        for (String r : traditional.recommendations()) {
            if (!recommendations.contains(r)) {
                recommendations.add(r);
            }
        }
        var conditions = EnumSet.noneOf(RiskCondition.class);
        conditions.addAll(ai.conditions());
        conditions.addAll(traditional.conditions());
        var details = new LinkedHashMap<String, Object>(traditional.details());
        details.putAll(ai.details());
        return new RiskScore(ai.dimension(), score, properties.getLevels().levelFor(score),
                ai.summary(), recommendations, Provenance.BLENDED,
                Math.min(ai.confidence(), traditional.confidence()), conditions, agreement, details);
    }
}
