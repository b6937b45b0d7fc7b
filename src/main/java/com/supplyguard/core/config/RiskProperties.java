package com.supplyguard.core.config;

import com.supplyguard.core.model.RiskDimension;
import com.supplyguard.core.model.RiskLevel;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Tables and weights used by the analysis strategies and the aggregator.
 * Bound once at start-up from {@code supplyguard.risk.*} and treated as read-only afterwards.
 */
@Component
@ConfigurationProperties(prefix = "supplyguard.risk")
public class RiskProperties {

    private Levels levels = new Levels();
    private Thresholds thresholds = new Thresholds();
    private Statistical statistical = new Statistical();
    private Map<KeywordCategory, KeywordRule> keywords = defaultKeywords();
    private Map<String, Double> countryRisk = defaultCountryRisk();
    private Map<String, String> countryAliases = defaultCountryAliases();
    private double transitComplexityStep = 0.2;
    private List<String> alternativeHubs = new ArrayList<>(
            List.of("germany", "united states", "singapore", "united kingdom", "netherlands"));
    private TimeWindow timeWindow = new TimeWindow();
    private Map<RiskDimension, Double> aggregationWeights = new EnumMap<>(RiskDimension.class);
    private double divergenceThreshold = 40.0;
    private DisagreementPolicy disagreementPolicy = DisagreementPolicy.BLEND;

    /**
     * Lower bounds of the medium, high and critical bands; anything below
     * {@code medium} is low. Bounds are inclusive.
     */
    public static class Levels {
        private double medium = 30;
        private double high = 60;
        private double critical = 80;

        public RiskLevel levelFor(double score) {
            if (score >= critical) return RiskLevel.CRITICAL;
            if (score >= high) return RiskLevel.HIGH;
            if (score >= medium) return RiskLevel.MEDIUM;
            return RiskLevel.LOW;
        }

        public double getMedium() { return medium; }
        public void setMedium(double medium) { this.medium = medium; }
        public double getHigh() { return high; }
        public void setHigh(double high) { this.high = high; }
        public double getCritical() { return critical; }
        public void setCritical(double critical) { this.critical = critical; }
    }

    /**
     * Four ordered cut points. A value at or above {@code low} leaves the low band,
     * at or above {@code medium} reaches high, at or above {@code high} reaches
     * critical, and at or above {@code critical} saturates the score.
     */
    public static class Cutpoints {
        private double low;
        private double medium;
        private double high;
        private double critical;

        public Cutpoints() {}

        public Cutpoints(double low, double medium, double high, double critical) {
            this.low = low;
            this.medium = medium;
            this.high = high;
            this.critical = critical;
        }

        public double getLow() { return low; }
        public void setLow(double low) { this.low = low; }
        public double getMedium() { return medium; }
        public void setMedium(double medium) { this.medium = medium; }
        public double getHigh() { return high; }
        public void setHigh(double high) { this.high = high; }
        public double getCritical() { return critical; }
        public void setCritical(double critical) { this.critical = critical; }
    }

    public static class Thresholds {
        private Cutpoints delayPercentage = new Cutpoints(10, 25, 50, 75);
        private Cutpoints highImpactEvents = new Cutpoints(2, 5, 10, 15);
        private Cutpoints averageDelayDays = new Cutpoints(3, 7, 14, 30);
        private Map<RiskLevel, Double> levelScores = new EnumMap<>(Map.of(
                RiskLevel.LOW, 25.0, RiskLevel.MEDIUM, 50.0, RiskLevel.HIGH, 75.0, RiskLevel.CRITICAL, 90.0));

        public Cutpoints getDelayPercentage() { return delayPercentage; }
        public void setDelayPercentage(Cutpoints delayPercentage) { this.delayPercentage = delayPercentage; }
        public Cutpoints getHighImpactEvents() { return highImpactEvents; }
        public void setHighImpactEvents(Cutpoints highImpactEvents) { this.highImpactEvents = highImpactEvents; }
        public Cutpoints getAverageDelayDays() { return averageDelayDays; }
        public void setAverageDelayDays(Cutpoints averageDelayDays) { this.averageDelayDays = averageDelayDays; }
        public Map<RiskLevel, Double> getLevelScores() { return levelScores; }
        public void setLevelScores(Map<RiskLevel, Double> levelScores) { this.levelScores = levelScores; }
    }

    public static class Statistical {
        private double delayWeight = 0.5;
        private double eventWeight = 0.5;

        public double getDelayWeight() { return delayWeight; }
        public void setDelayWeight(double delayWeight) { this.delayWeight = delayWeight; }
        public double getEventWeight() { return eventWeight; }
        public void setEventWeight(double eventWeight) { this.eventWeight = eventWeight; }
    }

    public static class KeywordRule {
        private double weight;
        private List<String> terms = new ArrayList<>();

        public KeywordRule() {}

        public KeywordRule(double weight, List<String> terms) {
            this.weight = weight;
            this.terms = new ArrayList<>(terms);
        }

        public double getWeight() { return weight; }
        public void setWeight(double weight) { this.weight = weight; }
        public List<String> getTerms() { return terms; }
        public void setTerms(List<String> terms) { this.terms = terms; }
    }

    /**
     * Window upper bounds in days (immediate, short, medium, long) and the
     * decay applied to each window's raw severity.
     */
    public static class TimeWindow {
        private List<Integer> windowDays = new ArrayList<>(List.of(1, 7, 30, 90));
        private List<Double> decayFactors = new ArrayList<>(List.of(1.0, 0.8, 0.5, 0.2));
        private double trendBand = 0.2;

        public List<Integer> getWindowDays() { return windowDays; }
        public void setWindowDays(List<Integer> windowDays) { this.windowDays = windowDays; }
        public List<Double> getDecayFactors() { return decayFactors; }
        public void setDecayFactors(List<Double> decayFactors) { this.decayFactors = decayFactors; }
        public double getTrendBand() { return trendBand; }
        public void setTrendBand(double trendBand) { this.trendBand = trendBand; }
    }

    /**
     * Resolves a free-form country name or alias to the lower-case key used by
     * {@link #getCountryRisk()}, or returns the normalized input when unknown.
     */
    public String canonicalCountry(String raw) {
        if (raw == null) {
            return "";
        }
        String key = raw.trim().toLowerCase(Locale.ROOT);
        return countryAliases.getOrDefault(key, key);
    }

    public double weightFor(RiskDimension dimension) {
        return aggregationWeights.getOrDefault(dimension, 1.0);
    }

    private static Map<KeywordCategory, KeywordRule> defaultKeywords() {
        var map = new EnumMap<KeywordCategory, KeywordRule>(KeywordCategory.class);
        map.put(KeywordCategory.POLITICAL, new KeywordRule(10, List.of(
                "war", "conflict", "coup", "revolution", "sanction", "embargo",
                "election", "government", "policy", "regulation", "diplomatic", "political")));
        map.put(KeywordCategory.LOGISTICS, new KeywordRule(8, List.of(
                "blockade", "strike", "shutdown", "disaster", "congestion", "disruption",
                "delay", "port", "shipping", "transport", "logistics", "cargo")));
        map.put(KeywordCategory.TARIFF, new KeywordRule(8, List.of(
                "trade war", "tariff", "duty", "quota", "restriction", "ban",
                "customs", "import", "export")));
        map.put(KeywordCategory.SCHEDULE, new KeywordRule(6, List.of(
                "cancelled", "suspended", "postponed", "rescheduled", "behind",
                "deadline", "schedule", "timeline", "delivery")));
        return map;
    }

    private static Map<String, Double> defaultCountryRisk() {
        var map = new LinkedHashMap<String, Double>();
        map.put("united states", 20.0);
        map.put("germany", 15.0);
        map.put("japan", 18.0);
        map.put("united kingdom", 22.0);
        map.put("france", 25.0);
        map.put("canada", 18.0);
        map.put("netherlands", 15.0);
        map.put("singapore", 12.0);
        map.put("taiwan", 40.0);
        map.put("south korea", 30.0);
        map.put("italy", 35.0);
        map.put("china", 45.0);
        map.put("india", 50.0);
        map.put("russia", 70.0);
        map.put("iran", 85.0);
        map.put("north korea", 95.0);
        map.put("venezuela", 80.0);
        map.put("syria", 90.0);
        return map;
    }

    private static Map<String, String> defaultCountryAliases() {
        var map = new LinkedHashMap<String, String>();
        map.put("usa", "united states");
        map.put("america", "united states");
        map.put("uk", "united kingdom");
        map.put("britain", "united kingdom");
        map.put("korea", "south korea");
        map.put("prc", "china");
        map.put("holland", "netherlands");
        map.put("中國", "china");
        map.put("美國", "united states");
        map.put("日本", "japan");
        map.put("德國", "germany");
        map.put("韓國", "south korea");
        map.put("台灣", "taiwan");
        map.put("荷蘭", "netherlands");
        map.put("英國", "united kingdom");
        return map;
    }

    public Levels getLevels() { return levels; }
    public void setLevels(Levels levels) { this.levels = levels; }
    public Thresholds getThresholds() { return thresholds; }
    public void setThresholds(Thresholds thresholds) { this.thresholds = thresholds; }
    public Statistical getStatistical() { return statistical; }
    public void setStatistical(Statistical statistical) { this.statistical = statistical; }
    public Map<KeywordCategory, KeywordRule> getKeywords() { return keywords; }
    public void setKeywords(Map<KeywordCategory, KeywordRule> keywords) { this.keywords = keywords; }
    public Map<String, Double> getCountryRisk() { return countryRisk; }
    public void setCountryRisk(Map<String, Double> countryRisk) { this.countryRisk = countryRisk; }
    public Map<String, String> getCountryAliases() { return countryAliases; }
    public void setCountryAliases(Map<String, String> countryAliases) { this.countryAliases = countryAliases; }
    public double getTransitComplexityStep() { return transitComplexityStep; }
    public void setTransitComplexityStep(double transitComplexityStep) { this.transitComplexityStep = transitComplexityStep; }
    public List<String> getAlternativeHubs() { return alternativeHubs; }
    public void setAlternativeHubs(List<String> alternativeHubs) { this.alternativeHubs = alternativeHubs; }
    public TimeWindow getTimeWindow() { return timeWindow; }
    public void setTimeWindow(TimeWindow timeWindow) { this.timeWindow = timeWindow; }
    public Map<RiskDimension, Double> getAggregationWeights() { return aggregationWeights; }
    public void setAggregationWeights(Map<RiskDimension, Double> aggregationWeights) { this.aggregationWeights = aggregationWeights; }
    public double getDivergenceThreshold() { return divergenceThreshold; }
    public void setDivergenceThreshold(double divergenceThreshold) { this.divergenceThreshold = divergenceThreshold; }
    public DisagreementPolicy getDisagreementPolicy() { return disagreementPolicy; }
    public void setDisagreementPolicy(DisagreementPolicy disagreementPolicy) { this.disagreementPolicy = disagreementPolicy; }
}
