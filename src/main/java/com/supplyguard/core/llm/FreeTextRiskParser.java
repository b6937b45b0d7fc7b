package com.supplyguard.core.llm;

import com.supplyguard.core.model.Provenance;
import com.supplyguard.core.model.RiskCondition;
import com.supplyguard.core.model.RiskDimension;
import com.supplyguard.core.model.RiskLevel;
import com.supplyguard.core.model.RiskScore;
import com.supplyguard.core.strategy.KeywordMatcher;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * Best-effort reading of a model answer that is not valid JSON. The whole
 * answer is kept as the summary and the result is marked
 * {@link RiskCondition#FREE_TEXT_RESPONSE} with a low confidence.
 */
public final class FreeTextRiskParser {

    static final double FREE_TEXT_CONFIDENCE = 0.4;
    private static final int MAX_RECOMMENDATIONS = 5;

    private FreeTextRiskParser() {}

    public static RiskScore parse(String text, RiskDimension dimension) {
        String raw = text == null ? "" : text.trim();
        String lower = KeywordMatcher.normalize(raw);

        double score;
        RiskLevel level;
        if (lower.contains("critical") || lower.contains("high risk") || lower.contains("severe")) {
            score = 85;
            level = RiskLevel.CRITICAL;
        } else if (lower.contains("high") || lower.contains("significant")) {
            score = 70;
            level = RiskLevel.HIGH;
        } else if (lower.contains("low") || lower.contains("minimal")) {
            score = 25;
            level = RiskLevel.LOW;
        } else {
            score = 50;
            level = RiskLevel.MEDIUM;
        }

        var recommendations = new ArrayList<String>();
        for (String line : raw.split("\\R")) {
            String trimmed = line.trim().replaceFirst("^[-*\\d.)\\s]+", "");
            String l = KeywordMatcher.normalize(trimmed);
            if (!trimmed.isEmpty() && (l.contains("recommend") || l.contains("suggest") || l.contains("should"))) {
                recommendations.add(trimmed);
                if (recommendations.size() == MAX_RECOMMENDATIONS) {
                    break;
                }
            }
        }

        var details = new LinkedHashMap<String, Object>();
        details.put("parsed_from", "free_text");
        return new RiskScore(dimension, score, level, raw, List.copyOf(recommendations), Provenance.AI,
                FREE_TEXT_CONFIDENCE, Set.of(RiskCondition.FREE_TEXT_RESPONSE), null, details);
    }
}
