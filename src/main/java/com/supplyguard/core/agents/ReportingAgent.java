package com.supplyguard.core.agents;

import com.supplyguard.core.aggregate.RiskAggregator;
import com.supplyguard.core.config.PipelineProperties;
import com.supplyguard.core.model.AgentInvocation;
import com.supplyguard.core.model.AgentRole;
import com.supplyguard.core.model.RiskCondition;
import com.supplyguard.core.model.RiskDimension;
import com.supplyguard.core.model.RiskScore;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

/**
 * Final pipeline stage: folds the succeeded dimension scores of earlier tiers
 * into one overall verdict.
 *
 * <p>Failed and timed-out invocations do not contribute a score; each one lowers
 * the overall confidence by the share of the pipeline it represents. A
 * truncated pipeline further scales confidence by
 * {@link PipelineProperties#getTruncatedConfidenceFactor()}.
 */
@Component
public class ReportingAgent implements RiskAgent {

    private static final int PER_DIMENSION_RECOMMENDATIONS = 2;

    private final RiskAggregator aggregator;
    private final PipelineProperties properties;

    public ReportingAgent(RiskAggregator aggregator, PipelineProperties properties) {
        this.aggregator = aggregator;
        this.properties = properties;
    }

    @Override
    public AgentRole role() {
        return AgentRole.REPORTING;
    }

    @Override
    public AgentCapability capability() {
        return new AgentCapability(role().name(), role().agentName(),
                "Combines the findings of every analyst into an overall risk report",
                List.of("weighted risk aggregation", "recommendation ranking", "agreement reporting"),
                List.of("Give me an overall risk report for our robotics shipments"));
    }

    @Override
    public RiskScore analyze(AgentContext context) {
        var prior = context.priorInvocations().stream()
                .filter(inv -> inv.role() != AgentRole.REPORTING)
                .toList();
        var succeeded = prior.stream().filter(AgentInvocation::succeeded).toList();

        var byDimension = new EnumMap<RiskDimension, RiskScore>(RiskDimension.class);
        for (var inv : succeeded) {
            byDimension.put(inv.dimension(), inv.score());
        }

        RiskScore overall = aggregator.aggregate(byDimension);
        double confidence = overall.confidence();
        if (!prior.isEmpty()) {
            confidence *= (double) succeeded.size() / prior.size();
        }
        if (prior.size() > succeeded.size()) {
            overall = overall.withCondition(RiskCondition.AGENT_FAILURE);
        }
        if (context.truncated()) {
            confidence *= properties.getTruncatedConfidenceFactor();
            overall = overall.withCondition(RiskCondition.PIPELINE_TRUNCATED);
        }

        var details = new LinkedHashMap<String, Object>();
        details.put("agents_succeeded", succeeded.size());
        details.put("agents_total", prior.size());
        details.put("affected_equipment", collect(succeeded, "affected_equipment"));
        details.put("recent_events", collect(succeeded, "recent_events"));
        var failed = prior.stream().filter(inv -> !inv.succeeded())
                .map(inv -> inv.role().agentName() + ": " + inv.status().name().toLowerCase(Locale.ROOT))
                .toList();
        if (!failed.isEmpty()) {
            details.put("failed_agents", failed);
        }

        return overall
                .withConfidence(confidence)
                .withRecommendations(rankRecommendations(succeeded))
                .withDetails(details);
    }

    /**
     * The top entries of each dimension in pipeline order, then the remaining
     * ones, de-duplicated and capped.
     */
    List<String> rankRecommendations(List<AgentInvocation> succeeded) {
        var ranked = new LinkedHashSet<String>();
        for (var inv : succeeded) {
            inv.score().recommendations().stream().limit(PER_DIMENSION_RECOMMENDATIONS).forEach(ranked::add);
        }
        for (var inv : succeeded) {
            ranked.addAll(inv.score().recommendations());
        }
        return ranked.stream().limit(properties.getMaxRecommendations()).toList();
    }

    private static List<String> collect(List<AgentInvocation> invocations, String key) {
        var values = new LinkedHashSet<String>();
        for (var inv : invocations) {
            Object value = inv.score().details().get(key);
            if (value instanceof Collection<?> items) {
                items.forEach(item -> values.add(String.valueOf(item)));
            }
        }
        return new ArrayList<>(values);
    }
}
