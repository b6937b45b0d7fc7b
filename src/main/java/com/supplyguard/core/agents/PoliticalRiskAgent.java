package com.supplyguard.core.agents;

import com.supplyguard.core.aggregate.RiskAggregator;
import com.supplyguard.core.config.KeywordCategory;
import com.supplyguard.core.config.RiskProperties;
import com.supplyguard.core.llm.AiRiskAdapter;
import com.supplyguard.core.metrics.SupplyGuardMetrics;
import com.supplyguard.core.model.AgentRole;
import com.supplyguard.core.model.Equipment;
import com.supplyguard.core.model.NewsCategory;
import com.supplyguard.core.model.NewsEvent;
import com.supplyguard.core.model.Provenance;
import com.supplyguard.core.model.RiskCondition;
import com.supplyguard.core.model.RiskDimension;
import com.supplyguard.core.model.RiskScore;
import com.supplyguard.core.storage.DataFilter;
import com.supplyguard.core.storage.SupplyChainRepository;
import com.supplyguard.core.strategy.KeywordStrategy;
import com.supplyguard.core.strategy.TimeWindowStrategy;
import com.supplyguard.core.strategy.TradeRouteStrategy;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Political risk from recent political news (keyword and time-window scoring)
 * combined with the base risk of the countries in play. Countries come from
 * the query, or from the manufacturing countries of matching equipment.
 */
@Component
public class PoliticalRiskAgent extends AbstractRiskAgent {

    static final double EVENT_WEIGHT = 0.6;
    static final double COUNTRY_WEIGHT = 0.4;

    private final SupplyChainRepository repository;
    private final KeywordStrategy keyword;
    private final TimeWindowStrategy timeWindow;
    private final TradeRouteStrategy tradeRoute;
    private final RiskProperties riskProperties;

    public PoliticalRiskAgent(SupplyChainRepository repository, KeywordStrategy keyword,
                              TimeWindowStrategy timeWindow, TradeRouteStrategy tradeRoute,
                              RiskProperties riskProperties, AiRiskAdapter aiAdapter,
                              RiskAggregator aggregator, SupplyGuardMetrics metrics, Clock clock) {
        super(aiAdapter, aggregator, metrics, clock);
        this.repository = repository;
        this.keyword = keyword;
        this.timeWindow = timeWindow;
        this.tradeRoute = tradeRoute;
        this.riskProperties = riskProperties;
    }

    @Override
    public AgentRole role() {
        return AgentRole.POLITICAL;
    }

    @Override
    public AgentCapability capability() {
        return new AgentCapability(role().name(), role().agentName(),
                "Assesses political and policy risk for sourcing and destination countries",
                List.of("political news scanning", "country risk profiles", "event trend detection"),
                List.of("What is the political risk for equipment from China?",
                        "How do recent elections affect our suppliers?",
                        "Are there sanctions affecting our supply chain?"));
    }

    @Override
    public RiskScore analyze(AgentContext context) {
        var filter = filterFor(context);
        List<NewsEvent> events = repository.findNewsEvents(EnumSet.of(NewsCategory.POLITICAL), filter);
        List<String> countries = targetCountries(context, filter);

        var details = new LinkedHashMap<String, Object>();
        var conditions = EnumSet.noneOf(RiskCondition.class);
        Double eventScore = null;
        String trend = null;
        if (!events.isEmpty()) {
            var texts = events.stream().map(NewsEvent::text).toList();
            RiskScore kw = keyword.scoreAll(RiskDimension.POLITICAL, texts, Set.of(KeywordCategory.POLITICAL));
            RiskScore window = timeWindow.score(RiskDimension.POLITICAL, events, List.of());
            eventScore = (kw.score() + window.score()) / 2.0;
            trend = (String) window.details().get("trend");
            details.put("keyword_score", kw.score());
            details.put("time_window_score", window.score());
            details.put("trend", trend);
        }

        Double countryScore = null;
        String riskiest = null;
        var unknown = new ArrayList<String>();
        for (String c : countries) {
            var risk = tradeRoute.countryRisk(c);
            if (risk.isEmpty()) {
                unknown.add(c);
            } else if (countryScore == null || risk.getAsDouble() > countryScore) {
                countryScore = risk.getAsDouble();
                riskiest = riskProperties.canonicalCountry(c);
            }
        }
        if (!unknown.isEmpty()) {
            conditions.add(RiskCondition.UNKNOWN_ENTITY);
            details.put("unknown_countries", unknown);
        }

        if (eventScore == null && countryScore == null) {
            var empty = RiskScore.insufficientData(RiskDimension.POLITICAL, "no political events or known countries");
            return unknown.isEmpty() ? empty : empty.withCondition(RiskCondition.UNKNOWN_ENTITY)
                    .withDetail("unknown_countries", unknown);
        }
        double score;
        if (eventScore != null && countryScore != null) {
            score = EVENT_WEIGHT * eventScore + COUNTRY_WEIGHT * countryScore;
        } else {
            score = eventScore != null ? eventScore : countryScore;
        }
        details.put("countries", countries);
        if (riskiest != null) {
            details.put("highest_risk_country", riskiest);
        }
        details.put("recent_events", recentEventTitles(events));

        var recommendations = new ArrayList<String>();
        if (riskiest != null && countryScore >= riskProperties.getLevels().getHigh()) {
            recommendations.add("Diversify suppliers away from " + riskiest);
        }
        if (riskiest != null) {
            recommendations.add("Watch political developments in " + riskiest + " closely");
        }
        if ("increasing".equals(trend)) {
            recommendations.add("Political event frequency is rising; increase monitoring cadence");
        }
        if (recommendations.isEmpty()) {
            recommendations.add("Continue monitoring political news for sourcing countries");
        }

        String summary = String.format("%d political event(s) reviewed across %d country(ies); political risk %.1f",
                events.size(), countries.size(), score);
        var traditional = new RiskScore(RiskDimension.POLITICAL, score,
                riskProperties.getLevels().levelFor(score), summary, recommendations, Provenance.TRADITIONAL,
                unknown.isEmpty() ? 0.8 : 0.6, conditions, null, details);

        var prompt = new LinkedHashMap<String, String>();
        prompt.put("Countries", String.join(", ", countries));
        prompt.put("Recent political events", String.join("; ", recentEventTitles(events)));
        return assessWithAi(context, traditional, prompt);
    }

    private List<String> targetCountries(AgentContext context, DataFilter filter) {
        var fromQuery = context.intent().entities().countries();
        if (!fromQuery.isEmpty()) {
            return fromQuery;
        }
        var countries = new LinkedHashSet<String>();
        for (Equipment e : repository.findEquipment(filter)) {
            if (e.manufacturingCountry() != null) {
                countries.add(riskProperties.canonicalCountry(e.manufacturingCountry()));
            }
        }
        return List.copyOf(countries);
    }
}
