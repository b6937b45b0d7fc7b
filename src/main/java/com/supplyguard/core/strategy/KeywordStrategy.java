package com.supplyguard.core.strategy;

import com.supplyguard.core.config.KeywordCategory;
import com.supplyguard.core.config.RiskProperties;
import com.supplyguard.core.model.Provenance;
import com.supplyguard.core.model.RiskDimension;
import com.supplyguard.core.model.RiskScore;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Scores text by weighted keyword occurrences: sum of category weight times
 * match count, capped at 100.
 */
@Component
public class KeywordStrategy {

    private final RiskProperties properties;

    public KeywordStrategy(RiskProperties properties) {
        this.properties = properties;
    }

    public RiskScore score(RiskDimension dimension, String text) {
        return score(dimension, text, EnumSet.allOf(KeywordCategory.class));
    }

    public RiskScore score(RiskDimension dimension, String text, Set<KeywordCategory> categories) {
        if (text == null || text.isBlank()) {
            return RiskScore.insufficientData(dimension, "no text to scan");
        }
        var counts = matchCounts(text, categories);
        double total = 0.0;
        int matches = 0;
        var perCategory = new LinkedHashMap<String, Object>();
        for (var entry : counts.entrySet()) {
            var rule = properties.getKeywords().get(entry.getKey());
            total += rule.getWeight() * entry.getValue();
            matches += entry.getValue();
            perCategory.put(entry.getKey().name().toLowerCase(Locale.ROOT), entry.getValue());
        }
        double score = Math.min(100.0, total);
        var details = new LinkedHashMap<String, Object>();
        details.put("matches_by_category", perCategory);
        details.put("total_matches", matches);
        String summary = matches == 0
                ? "No risk keywords found"
                : "Found " + matches + " risk keyword match(es)";
        return new RiskScore(dimension, score, properties.getLevels().levelFor(score), summary, List.of(),
                Provenance.TRADITIONAL, 0.7, Set.of(), null, details);
    }

    /** Joins the texts and scores them as one document. */
    public RiskScore scoreAll(RiskDimension dimension, List<String> texts, Set<KeywordCategory> categories) {
        return score(dimension, texts == null ? "" : String.join("\n", texts), categories);
    }

    public Map<KeywordCategory, Integer> matchCounts(String text, Set<KeywordCategory> categories) {
        var counts = new EnumMap<KeywordCategory, Integer>(KeywordCategory.class);
        for (var category : categories) {
            var rule = properties.getKeywords().get(category);
            if (rule == null) {
                continue;
            }
            counts.put(category, KeywordMatcher.countAll(text, rule.getTerms()));
        }
        return counts;
    }
}
