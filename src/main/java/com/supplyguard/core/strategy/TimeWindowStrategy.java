package com.supplyguard.core.strategy;

import com.supplyguard.core.config.RiskProperties;
import com.supplyguard.core.model.NewsEvent;
import com.supplyguard.core.model.Provenance;
import com.supplyguard.core.model.RiskDimension;
import com.supplyguard.core.model.RiskLevel;
import com.supplyguard.core.model.RiskScore;
import com.supplyguard.core.model.Schedule;
import com.supplyguard.core.model.Trend;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * Recency-weighted scoring. Events are bucketed by age and open schedules by
 * distance to their planned end, into the immediate, short, medium and long
 * windows; items past the last window are ignored.
 *
 * <p>Raw severity per item: event impact (1/3/5); schedule overdue 5,
 * high or critical risk 3, medium risk 2. Each window's raw total is
 * multiplied by its decay factor. The trend compares the immediate plus
 * short-term weighted total against the medium-term one.
 */
@Component
public class TimeWindowStrategy {

    private static final String[] WINDOW_NAMES = {"immediate", "short_term", "medium_term", "long_term"};

    private final RiskProperties properties;
    private final Clock clock;

    public TimeWindowStrategy(RiskProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public RiskScore score(RiskDimension dimension, List<NewsEvent> events, List<Schedule> schedules) {
        return score(dimension, events, schedules, clock.instant());
    }

    public RiskScore score(RiskDimension dimension, List<NewsEvent> events, List<Schedule> schedules,
                           Instant reference) {
        List<NewsEvent> eventList = events == null ? List.of() : events;
        List<Schedule> scheduleList = schedules == null ? List.of() : schedules;
        if (eventList.isEmpty() && scheduleList.isEmpty()) {
            return RiskScore.insufficientData(dimension, "no events or schedules in any time window");
        }

        var cfg = properties.getTimeWindow();
        int windows = cfg.getWindowDays().size();
        int[] counts = new int[windows];
        double[] raw = new double[windows];

        for (var event : eventList) {
            if (event.publishedAt() == null || event.impactLevel() == null) {
                continue;
            }
            double ageDays = Math.max(0.0, Duration.between(event.publishedAt(), reference).toSeconds() / 86_400.0);
            int bucket = bucketFor(ageDays);
            if (bucket >= 0) {
                counts[bucket]++;
                raw[bucket] += event.impactLevel().severity();
            }
        }

        LocalDate referenceDate = LocalDate.ofInstant(reference, ZoneOffset.UTC);
        for (var schedule : scheduleList) {
            if (!schedule.isOpen() || schedule.plannedEnd() == null) {
                continue;
            }
            double distance = Math.abs(ChronoUnit.DAYS.between(referenceDate, schedule.plannedEnd()));
            int bucket = bucketFor(distance);
            if (bucket >= 0) {
                counts[bucket]++;
                raw[bucket] += scheduleSeverity(schedule, referenceDate);
            }
        }

        double total = 0.0;
        double[] weighted = new double[windows];
        var windowDetails = new LinkedHashMap<String, Object>();
        for (int i = 0; i < windows; i++) {
            weighted[i] = raw[i] * cfg.getDecayFactors().get(i);
            total += weighted[i];
            var w = new LinkedHashMap<String, Object>();
            w.put("count", counts[i]);
            w.put("raw_severity", raw[i]);
            w.put("weighted_severity", StatisticalStrategy.round2(weighted[i]));
            windowDetails.put(i < WINDOW_NAMES.length ? WINDOW_NAMES[i] : "window_" + i, w);
        }

        double recent = weighted[0] + (windows > 1 ? weighted[1] : 0.0);
        double older = windows > 2 ? weighted[2] : 0.0;
        Trend trend = trend(recent, older, cfg.getTrendBand());

        double score = Math.min(100.0, total);
        RiskLevel level = properties.getLevels().levelFor(score);
        var details = new LinkedHashMap<String, Object>();
        details.put("windows", windowDetails);
        details.put("trend", trend.wireName());
        String summary = String.format("Time-weighted severity %.1f, trend %s", score, trend.wireName());
        return new RiskScore(dimension, score, level, summary, List.of(), Provenance.TRADITIONAL,
                0.75, Set.of(), null, details);
    }

    static Trend trend(double recent, double older, double band) {
        if (recent == 0.0 && older == 0.0) {
            return Trend.STABLE;
        }
        if (recent > older * (1.0 + band)) {
            return Trend.INCREASING;
        }
        if (recent < older * (1.0 - band)) {
            return Trend.DECREASING;
        }
        return Trend.STABLE;
    }

    private int bucketFor(double days) {
        var bounds = properties.getTimeWindow().getWindowDays();
        for (int i = 0; i < bounds.size(); i++) {
            if (days <= bounds.get(i)) {
                return i;
            }
        }
        return -1;
    }

    private static int scheduleSeverity(Schedule schedule, LocalDate reference) {
        if (schedule.isOverdue(reference)) {
            return 5;
        }
        if (schedule.riskLevel() == RiskLevel.HIGH || schedule.riskLevel() == RiskLevel.CRITICAL) {
            return 3;
        }
        if (schedule.riskLevel() == RiskLevel.MEDIUM) {
            return 2;
        }
        return 0;
    }
}
