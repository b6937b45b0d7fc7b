package com.supplyguard.core.agents;

import com.supplyguard.core.aggregate.RiskAggregator;
import com.supplyguard.core.llm.AiPrompts;
import com.supplyguard.core.llm.AiRiskAdapter;
import com.supplyguard.core.metrics.SupplyGuardMetrics;
import com.supplyguard.core.model.NewsEvent;
import com.supplyguard.core.model.Provenance;
import com.supplyguard.core.model.RiskCondition;
import com.supplyguard.core.model.RiskScore;
import com.supplyguard.core.storage.DataFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Shared plumbing for the domain agents: building the storage filter from the
 * intent, and asking the AI adapter with a traditional fallback.
 */
public abstract class AbstractRiskAgent implements RiskAgent {

    private static final Logger log = LoggerFactory.getLogger(AbstractRiskAgent.class);

    protected static final int LIST_LIMIT = 5;

    protected final AiRiskAdapter aiAdapter;
    protected final RiskAggregator aggregator;
    protected final SupplyGuardMetrics metrics;
    protected final Clock clock;

    protected AbstractRiskAgent(AiRiskAdapter aiAdapter, RiskAggregator aggregator,
                                SupplyGuardMetrics metrics, Clock clock) {
        this.aiAdapter = aiAdapter;
        this.aggregator = aggregator;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Countries, equipment categories and ids from the intent; {@code since} is set
     * only when the query named a time window.
     */
    protected DataFilter filterFor(AgentContext context) {
        var entities = context.intent().entities();
        var since = entities.timeWindowDays() == null
                ? null
                : clock.instant().minus(Duration.ofDays(entities.timeWindowDays()));
        return new DataFilter(entities.countries(), entities.equipmentCategories(), since, entities.equipmentIds());
    }

    /**
     * Returns the AI assessment reconciled with {@code traditional}, or
     * {@code traditional} tagged {@link Provenance#TRADITIONAL_FALLBACK} when
     * the AI is unavailable.
     */
    protected RiskScore assessWithAi(AgentContext context, RiskScore traditional, Map<String, String> promptContext) {
        var result = aiAdapter.invoke(AiPrompts.userPrompt(context.query().text(), promptContext), role().dimension());
        if (result.isAvailable()) {
            return withTraditionalEvidence(aggregator.reconcile(result.score(), traditional), traditional);
        }
        log.warn("{} falling back to traditional analysis: {}", role().agentName(), result.unavailableReason());
        if (metrics != null) {
            metrics.recordAiFallback(role().dimension().wireName(), fallbackReason(result.unavailableReason()));
        }
        return traditional
                .withProvenance(Provenance.TRADITIONAL_FALLBACK)
                .withCondition(RiskCondition.AI_UNAVAILABLE)
                .withDetail("ai_unavailable_reason", result.unavailableReason());
    }

    /**
     * Keeps the data-derived details (affected equipment, recent events) and
     * recommendations the reconciled score does not already carry.
     */
    private static RiskScore withTraditionalEvidence(RiskScore reconciled, RiskScore traditional) {
        var carried = new LinkedHashMap<String, Object>();
        traditional.details().forEach((key, value) -> {
            if (!reconciled.details().containsKey(key)) {
                carried.put(key, value);
            }
        });
        RiskScore merged = reconciled.withDetails(carried);
        return merged.recommendations().isEmpty()
                ? merged.withRecommendations(traditional.recommendations())
                : merged;
    }

    /** Newest first; ties by id so output is stable. */
    protected static List<String> recentEventTitles(List<NewsEvent> events) {
        return events.stream()
                .filter(e -> e.publishedAt() != null)
                .sorted(Comparator.comparing(NewsEvent::publishedAt).reversed()
                        .thenComparing(NewsEvent::id, Comparator.nullsLast(Comparator.naturalOrder())))
                .limit(LIST_LIMIT)
                .map(NewsEvent::title)
                .toList();
    }

    private static String fallbackReason(String reason) {
        if (reason == null) return "unknown";
        String lower = reason.toLowerCase(Locale.ROOT);
        if (lower.contains("disabled")) return "disabled";
        if (lower.contains("slot")) return "rate_limited";
        if (lower.contains("timed out")) return "timeout";
        return "error";
    }
}
