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
import com.supplyguard.core.model.RiskLevel;
import com.supplyguard.core.model.RiskScore;
import com.supplyguard.core.model.TradeRoute;
import com.supplyguard.core.storage.DataFilter;
import com.supplyguard.core.storage.SupplyChainRepository;
import com.supplyguard.core.strategy.KeywordStrategy;
import com.supplyguard.core.strategy.ThresholdStrategy;
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
 * Trade-policy risk: the mean of threshold classification of high-impact
 * tariff news, tariff keyword density, and trade-route risk between the
 * country pairs involved.
 */
@Component
public class TariffAgent extends AbstractRiskAgent {

    private final SupplyChainRepository repository;
    private final ThresholdStrategy threshold;
    private final KeywordStrategy keyword;
    private final TradeRouteStrategy tradeRoute;
    private final RiskProperties riskProperties;

    public TariffAgent(SupplyChainRepository repository, ThresholdStrategy threshold, KeywordStrategy keyword,
                       TradeRouteStrategy tradeRoute, RiskProperties riskProperties,
                       AiRiskAdapter aiAdapter, RiskAggregator aggregator,
                       SupplyGuardMetrics metrics, Clock clock) {
        super(aiAdapter, aggregator, metrics, clock);
        this.repository = repository;
        this.threshold = threshold;
        this.keyword = keyword;
        this.tradeRoute = tradeRoute;
        this.riskProperties = riskProperties;
    }

    @Override
    public AgentRole role() {
        return AgentRole.TARIFF;
    }

    @Override
    public AgentCapability capability() {
        return new AgentCapability(role().name(), role().agentName(),
                "Analyzes tariffs, trade disputes and customs changes affecting equipment costs",
                List.of("tariff news classification", "trade relationship risk", "customs exposure"),
                List.of("How do new tariffs affect imports from China?",
                        "Is there a trade war risk for our suppliers?",
                        "What customs duty changes should we expect?"));
    }

    @Override
    public RiskScore analyze(AgentContext context) {
        var filter = filterFor(context);
        List<NewsEvent> events = repository.findNewsEvents(
                EnumSet.of(NewsCategory.TARIFF, NewsCategory.ECONOMIC), filter);
        List<TradeRoute> routes = tradeRoutes(context, filter);
        if (events.isEmpty() && routes.isEmpty()) {
            return RiskScore.insufficientData(RiskDimension.TARIFF, "no tariff events or trade relationships");
        }

        var details = new LinkedHashMap<String, Object>();
        var conditions = EnumSet.noneOf(RiskCondition.class);
        double sum = 0.0;
        int parts = 0;
        RiskLevel thresholdLevel = null;

        if (!events.isEmpty()) {
            long highImpact = events.stream().filter(NewsEvent::isHighImpact).count();
            RiskScore t = threshold.score(RiskDimension.TARIFF,
                    new ThresholdStrategy.Metrics(null, (double) highImpact, null));
            RiskScore kw = keyword.scoreAll(RiskDimension.TARIFF,
                    events.stream().map(NewsEvent::text).toList(), Set.of(KeywordCategory.TARIFF));
            sum += t.score() + kw.score();
            parts += 2;
            thresholdLevel = t.level();
            details.put("high_impact_events", highImpact);
            details.put("threshold_level", t.level().wireName());
            details.put("keyword_score", kw.score());
        }

        String riskiestRoute = null;
        if (!routes.isEmpty()) {
            RiskScore r = tradeRoute.scoreRoutes(RiskDimension.TARIFF, routes);
            sum += r.score();
            parts++;
            details.put("trade_route_score", r.score());
            details.put("trade_relationships", r.details().get("route_scores"));
            if (r.hasCondition(RiskCondition.UNKNOWN_ENTITY)) {
                conditions.add(RiskCondition.UNKNOWN_ENTITY);
                details.put("unknown_countries", r.details().get("unknown_countries"));
            }
            double worst = -1;
            for (var route : routes) {
                double s = tradeRoute.score(RiskDimension.TARIFF, route).score();
                if (s > worst) {
                    worst = s;
                    riskiestRoute = route.describe();
                }
            }
        }
        details.put("recent_events", recentEventTitles(events));

        var recommendations = new ArrayList<String>();
        if (thresholdLevel != null && thresholdLevel.ordinal() >= RiskLevel.HIGH.ordinal()) {
            recommendations.add("Model landed-cost impact of announced tariff changes");
        }
        if (riskiestRoute != null) {
            recommendations.add("Track tariff policy changes on " + riskiestRoute);
        }
        recommendations.add("Review customs classifications and available trade agreement exemptions");

        double score = sum / parts;
        String summary = String.format("%d tariff/economic event(s) and %d trade relationship(s) reviewed; tariff risk %.1f",
                events.size(), routes.size(), score);
        var traditional = new RiskScore(RiskDimension.TARIFF, score, riskProperties.getLevels().levelFor(score),
                summary, recommendations, Provenance.TRADITIONAL,
                conditions.isEmpty() ? 0.8 : 0.6, conditions, null, details);

        var prompt = new LinkedHashMap<String, String>();
        prompt.put("Trade relationships", String.join("; ", routes.stream().map(TradeRoute::describe).toList()));
        prompt.put("Recent tariff events", String.join("; ", recentEventTitles(events)));
        return assessWithAi(context, traditional, prompt);
    }

    /**
     * Consecutive pairs of the countries named in the query, or the equipment
     * routes when fewer than two were named.
     */
    private List<TradeRoute> tradeRoutes(AgentContext context, DataFilter filter) {
        var countries = context.intent().entities().countries();
        var routes = new LinkedHashSet<TradeRoute>();
        if (countries.size() >= 2) {
            for (int i = 0; i + 1 < countries.size(); i++) {
                routes.add(TradeRoute.direct(countries.get(i), countries.get(i + 1)));
            }
        } else {
            for (Equipment e : repository.findEquipment(filter)) {
                routes.add(e.route());
            }
        }
        return List.copyOf(routes);
    }
}
