package com.supplyguard.core.agents;

import com.supplyguard.core.aggregate.RiskAggregator;
import com.supplyguard.core.llm.AiRiskAdapter;
import com.supplyguard.core.metrics.SupplyGuardMetrics;
import com.supplyguard.core.model.AgentRole;
import com.supplyguard.core.model.Equipment;
import com.supplyguard.core.model.RiskDimension;
import com.supplyguard.core.model.RiskScore;
import com.supplyguard.core.model.Schedule;
import com.supplyguard.core.storage.SupplyChainRepository;
import com.supplyguard.core.strategy.StatisticalStrategy;
import com.supplyguard.core.strategy.ThresholdStrategy;
import com.supplyguard.core.strategy.TimeWindowStrategy;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Delivery schedule risk. The score is the statistical delay analysis; the
 * threshold level, time-window trend and upcoming deadlines are reported
 * alongside it.
 */
@Component
public class SchedulerAgent extends AbstractRiskAgent {

    static final int DEADLINE_HORIZON_DAYS = 30;

    private final SupplyChainRepository repository;
    private final StatisticalStrategy statistical;
    private final ThresholdStrategy threshold;
    private final TimeWindowStrategy timeWindow;

    public SchedulerAgent(SupplyChainRepository repository, StatisticalStrategy statistical,
                          ThresholdStrategy threshold, TimeWindowStrategy timeWindow,
                          AiRiskAdapter aiAdapter, RiskAggregator aggregator,
                          SupplyGuardMetrics metrics, Clock clock) {
        super(aiAdapter, aggregator, metrics, clock);
        this.repository = repository;
        this.statistical = statistical;
        this.threshold = threshold;
        this.timeWindow = timeWindow;
    }

    @Override
    public AgentRole role() {
        return AgentRole.SCHEDULER;
    }

    @Override
    public AgentCapability capability() {
        return new AgentCapability(role().name(), role().agentName(),
                "Analyzes equipment delivery schedules for delays and deadline risk",
                List.of("delay statistics", "threshold classification", "upcoming deadlines", "affected equipment"),
                List.of("What are the schedule risks?", "Which deliveries are delayed?",
                        "Are there deadlines at risk in the next 2 weeks?"));
    }

    @Override
    public RiskScore analyze(AgentContext context) {
        var filter = filterFor(context);
        List<Schedule> schedules = repository.findSchedules(filter);
        Map<String, Equipment> equipment = repository.findEquipment(filter).stream()
                .collect(Collectors.toMap(Equipment::id, Function.identity(), (a, b) -> a, LinkedHashMap::new));

        RiskScore base = statistical.score(RiskDimension.SCHEDULING, schedules, List.of());
        if (schedules.isEmpty()) {
            return base;
        }
        RiskScore thresholdScore = threshold.score(RiskDimension.SCHEDULING, schedules, List.of());
        RiskScore windowScore = timeWindow.score(RiskDimension.SCHEDULING, List.of(), schedules);
        LocalDate today = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);

        var stats = StatisticalStrategy.ScheduleStats.of(schedules);
        List<String> deadlines = upcomingDeadlines(schedules, today);
        List<String> affected = affectedEquipment(schedules, equipment);

        var details = new LinkedHashMap<String, Object>();
        details.put("threshold_level", thresholdScore.level().wireName());
        details.put("trend", windowScore.details().get("trend"));
        details.put("upcoming_deadlines", deadlines);
        details.put("affected_equipment", affected);

        var recommendations = new ArrayList<String>();
        if (stats.delayPercentage() > 20) {
            recommendations.add("Review delayed schedules and agree recovery plans with suppliers");
        }
        if (stats.averageDelayDays() > 7) {
            recommendations.add("Add schedule buffer for equipment with long average delays");
        }
        if (!deadlines.isEmpty()) {
            recommendations.add("Confirm readiness for " + deadlines.size()
                    + " delivery(ies) due within " + DEADLINE_HORIZON_DAYS + " days");
        }
        if ("increasing".equals(windowScore.details().get("trend"))) {
            recommendations.add("Schedule pressure is rising; raise supplier check-in frequency");
        }
        if (recommendations.isEmpty()) {
            recommendations.add("Keep monitoring delivery schedules");
        }

        RiskScore traditional = base.withDetails(details).withRecommendations(recommendations);
        var prompt = new LinkedHashMap<String, String>();
        prompt.put("Schedules", stats.total() + " total, " + stats.delayed() + " delayed");
        prompt.put("Average delay days", String.format("%.1f", stats.averageDelayDays()));
        prompt.put("Upcoming deadlines", String.valueOf(deadlines.size()));
        return assessWithAi(context, traditional, prompt);
    }

    private static List<String> upcomingDeadlines(List<Schedule> schedules, LocalDate today) {
        return schedules.stream()
                .filter(Schedule::isOpen)
                .filter(s -> s.plannedEnd() != null)
                .filter(s -> {
                    long days = ChronoUnit.DAYS.between(today, s.plannedEnd());
                    return days >= 0 && days <= DEADLINE_HORIZON_DAYS;
                })
                .sorted(Comparator.comparing(Schedule::plannedEnd).thenComparing(Schedule::id))
                .limit(LIST_LIMIT)
                .map(s -> s.id() + " due " + s.plannedEnd())
                .toList();
    }

    private static List<String> affectedEquipment(List<Schedule> schedules, Map<String, Equipment> equipment) {
        var names = new LinkedHashSet<String>();
        for (var s : schedules) {
            if (s.isDelayed() && names.size() < LIST_LIMIT) {
                var eq = equipment.get(s.equipmentId());
                names.add(eq != null ? eq.name() : s.equipmentId());
            }
        }
        return List.copyOf(names);
    }
}
