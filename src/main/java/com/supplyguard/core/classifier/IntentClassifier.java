package com.supplyguard.core.classifier;

import com.supplyguard.core.model.Intent;
import com.supplyguard.core.model.QueryContext;
import com.supplyguard.core.model.RiskDimension;
import com.supplyguard.core.routing.PipelineTable;
import com.supplyguard.core.strategy.KeywordMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Ranked, non-exclusive domain classification.
 * <p>
 * Each domain rule awards points per keyword present (word-start match) and
 * per regex pattern found. Every domain with points is returned, strongest
 * first, ties broken by rule order. Text that matches nothing, including
 * blank text, is classified {@link RiskDimension#GENERAL}.
 */
@Component
public class IntentClassifier {

    private static final Logger log = LoggerFactory.getLogger(IntentClassifier.class);

    /** Match strength at which confidence saturates. */
    private static final double FULL_CONFIDENCE_POINTS = 10.0;

    private final EntityExtractor entityExtractor;
    private final PipelineTable pipelineTable;
    private final List<DomainRule> rules;

    public IntentClassifier(EntityExtractor entityExtractor, PipelineTable pipelineTable) {
        this(entityExtractor, pipelineTable, DomainRule.DEFAULTS);
    }

    IntentClassifier(EntityExtractor entityExtractor, PipelineTable pipelineTable, List<DomainRule> rules) {
        this.entityExtractor = entityExtractor;
        this.pipelineTable = pipelineTable;
        this.rules = List.copyOf(rules);
    }

    /**
     * @throws ClassifierFailureException if classification fails unexpectedly
     */
    public Intent classify(String queryText, QueryContext context) {
        try {
            String lower = KeywordMatcher.normalize(queryText);
            var strength = new EnumMap<RiskDimension, Integer>(RiskDimension.class);
            for (var rule : rules) {
                int points = score(rule, lower);
                if (points > 0) {
                    strength.put(rule.domain(), points);
                }
            }

            var entities = entityExtractor.extract(queryText, context);
            List<RiskDimension> ranked = rank(strength);
            double confidence;
            if (ranked.isEmpty()) {
                ranked = List.of(RiskDimension.GENERAL);
                confidence = 0.0;
            } else {
                confidence = Math.min(1.0, strength.get(ranked.get(0)) / FULL_CONFIDENCE_POINTS);
            }
            var plan = pipelineTable.planFor(ranked);
            log.debug("Classified query into {} (confidence {})", ranked, confidence);
            return new Intent(ranked, strength, entities, confidence, plan.sequence());
        } catch (RuntimeException e) {
            throw new ClassifierFailureException("Failed to classify query: " + e.getMessage(), e);
        }
    }

    private List<RiskDimension> rank(Map<RiskDimension, Integer> strength) {
        var order = new ArrayList<RiskDimension>();
        rules.forEach(r -> order.add(r.domain()));
        var ranked = new ArrayList<>(strength.keySet());
        ranked.sort(Comparator.<RiskDimension>comparingInt(strength::get).reversed()
                .thenComparingInt(order::indexOf));
        return ranked;
    }

    private static int score(DomainRule rule, String lower) {
        int points = 0;
        for (String keyword : rule.keywords()) {
            if (KeywordMatcher.containsWord(lower, keyword)) {
                points += DomainRule.KEYWORD_POINTS;
            }
        }
        for (var pattern : rule.patterns()) {
            if (pattern.matcher(lower).find()) {
                points += DomainRule.PATTERN_POINTS;
            }
        }
        return points;
    }
}
