package com.supplyguard.core.strategy;

import com.supplyguard.core.config.RiskProperties;
import com.supplyguard.core.model.NewsEvent;
import com.supplyguard.core.model.Provenance;
import com.supplyguard.core.model.RiskDimension;
import com.supplyguard.core.model.RiskScore;
import com.supplyguard.core.model.Schedule;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * Delay statistics over schedules and high-impact ratio over news events,
 * folded into one score by a weighted sum.
 *
 * <p>A component whose collection is empty does not contribute and the
 * remaining weight is renormalized; when both are empty the result is the
 * insufficient-data zero score.
 */
@Component
public class StatisticalStrategy {

    private final RiskProperties properties;

    public StatisticalStrategy(RiskProperties properties) {
        this.properties = properties;
    }

    public RiskScore score(RiskDimension dimension, List<Schedule> schedules, List<NewsEvent> events) {
        List<Schedule> scheduleList = schedules == null ? List.of() : schedules;
        List<NewsEvent> eventList = events == null ? List.of() : events;
        if (scheduleList.isEmpty() && eventList.isEmpty()) {
            return RiskScore.insufficientData(dimension, "no schedules or news events");
        }

        var details = new LinkedHashMap<String, Object>();
        double weighted = 0.0;
        double weightSum = 0.0;
        var parts = new StringBuilder();

        if (!scheduleList.isEmpty()) {
            var stats = ScheduleStats.of(scheduleList);
            details.put("total_schedules", stats.total());
            details.put("delayed_schedules", stats.delayed());
            details.put("delay_percentage", round2(stats.delayPercentage()));
            details.put("average_delay_days", round2(stats.averageDelayDays()));
            double w = properties.getStatistical().getDelayWeight();
            weighted += w * stats.delayPercentage();
            weightSum += w;
            parts.append(String.format("%d of %d schedules delayed (%.1f%%), average delay %.1f days",
                    stats.delayed(), stats.total(), stats.delayPercentage(), stats.averageDelayDays()));
        }

        if (!eventList.isEmpty()) {
            long highImpact = eventList.stream().filter(NewsEvent::isHighImpact).count();
            double ratio = (double) highImpact / eventList.size();
            details.put("total_events", eventList.size());
            details.put("high_impact_events", highImpact);
            details.put("high_impact_ratio", round2(ratio));
            double w = properties.getStatistical().getEventWeight();
            weighted += w * ratio * 100.0;
            weightSum += w;
            if (parts.length() > 0) parts.append("; ");
            parts.append(String.format("%d of %d news events high impact", highImpact, eventList.size()));
        }

        double score = weightSum > 0 ? weighted / weightSum : 0.0;
        return new RiskScore(dimension, score, properties.getLevels().levelFor(score), parts.toString(),
                List.of(), Provenance.TRADITIONAL, 0.8, Set.of(), null, details);
    }

    static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    /**
     * Delay figures for a schedule collection. Average delay is taken over the
     * delayed schedules only.
     */
    public record ScheduleStats(int total, int delayed, double delayPercentage, double averageDelayDays) {

        public static ScheduleStats of(List<Schedule> schedules) {
            int total = schedules.size();
            int delayed = 0;
            long delayDays = 0;
            for (var s : schedules) {
                if (s.isDelayed()) {
                    delayed++;
                    delayDays += Math.max(0, s.delayDays());
                }
            }
            double pct = total == 0 ? 0.0 : delayed * 100.0 / total;
            double avg = delayed == 0 ? 0.0 : (double) delayDays / delayed;
            return new ScheduleStats(total, delayed, pct, avg);
        }
    }
}
