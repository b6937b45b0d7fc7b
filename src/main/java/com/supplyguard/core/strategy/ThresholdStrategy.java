package com.supplyguard.core.strategy;

import com.supplyguard.core.config.RiskProperties;
import com.supplyguard.core.config.RiskProperties.Cutpoints;
import com.supplyguard.core.model.NewsEvent;
import com.supplyguard.core.model.Provenance;
import com.supplyguard.core.model.RiskDimension;
import com.supplyguard.core.model.RiskLevel;
import com.supplyguard.core.model.RiskScore;
import com.supplyguard.core.model.Schedule;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * Classifies each metric against its own cut-point table and reports the most
 * severe resulting level.
 *
 * <p>Unlike {@link com.supplyguard.core.aggregate.RiskAggregator}, which derives
 * the overall level from the averaged score, this strategy takes the maximum
 * per-metric level.
 */
@Component
public class ThresholdStrategy {

    private final RiskProperties properties;

    public ThresholdStrategy(RiskProperties properties) {
        this.properties = properties;
    }

    /**
     * Metric values; a null metric was not measurable and is skipped.
     */
    public record Metrics(Double delayPercentage, Double highImpactEventCount, Double averageDelayDays) {

        public static Metrics from(List<Schedule> schedules, List<NewsEvent> events) {
            Double delayPct = null;
            Double avgDelay = null;
            if (schedules != null && !schedules.isEmpty()) {
                var stats = StatisticalStrategy.ScheduleStats.of(schedules);
                delayPct = stats.delayPercentage();
                avgDelay = stats.averageDelayDays();
            }
            Double highImpact = null;
            if (events != null && !events.isEmpty()) {
                highImpact = (double) events.stream().filter(NewsEvent::isHighImpact).count();
            }
            return new Metrics(delayPct, highImpact, avgDelay);
        }

        boolean isEmpty() {
            return delayPercentage == null && highImpactEventCount == null && averageDelayDays == null;
        }
    }

    public RiskScore score(RiskDimension dimension, List<Schedule> schedules, List<NewsEvent> events) {
        return score(dimension, Metrics.from(schedules, events));
    }

    public RiskScore score(RiskDimension dimension, Metrics metrics) {
        if (metrics == null || metrics.isEmpty()) {
            return RiskScore.insufficientData(dimension, "no metrics to classify");
        }
        var thresholds = properties.getThresholds();
        var perMetric = new LinkedHashMap<String, Object>();
        RiskLevel overall = RiskLevel.LOW;
        boolean saturated = false;

        if (metrics.delayPercentage() != null) {
            var level = classify(metrics.delayPercentage(), thresholds.getDelayPercentage());
            perMetric.put("delay_percentage", level.wireName());
            overall = RiskLevel.max(overall, level);
            saturated |= metrics.delayPercentage() >= thresholds.getDelayPercentage().getCritical();
        }
        if (metrics.highImpactEventCount() != null) {
            var level = classify(metrics.highImpactEventCount(), thresholds.getHighImpactEvents());
            perMetric.put("high_impact_events", level.wireName());
            overall = RiskLevel.max(overall, level);
            saturated |= metrics.highImpactEventCount() >= thresholds.getHighImpactEvents().getCritical();
        }
        if (metrics.averageDelayDays() != null) {
            var level = classify(metrics.averageDelayDays(), thresholds.getAverageDelayDays());
            perMetric.put("average_delay_days", level.wireName());
            overall = RiskLevel.max(overall, level);
            saturated |= metrics.averageDelayDays() >= thresholds.getAverageDelayDays().getCritical();
        }

        double score = saturated ? 100.0 : thresholds.getLevelScores().getOrDefault(overall, 0.0);
        var details = new LinkedHashMap<String, Object>();
        details.put("metric_levels", perMetric);
        details.put("saturated", saturated);
        String summary = "Threshold analysis: overall " + overall.wireName() + " across " + perMetric.size() + " metric(s)";
        return new RiskScore(dimension, score, overall, summary, List.of(), Provenance.TRADITIONAL,
                0.8, Set.of(), null, details);
    }

    /**
     * Band lookup with inclusive lower bounds: a value equal to a cut point
     * belongs to the band above it.
     */
    public static RiskLevel classify(double value, Cutpoints cut) {
        if (value >= cut.getHigh()) return RiskLevel.CRITICAL;
        if (value >= cut.getMedium()) return RiskLevel.HIGH;
        if (value >= cut.getLow()) return RiskLevel.MEDIUM;
        return RiskLevel.LOW;
    }
}
