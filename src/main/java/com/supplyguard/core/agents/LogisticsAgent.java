package com.supplyguard.core.agents;

import com.supplyguard.core.aggregate.RiskAggregator;
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
import com.supplyguard.core.model.TradeRoute;
import com.supplyguard.core.storage.SupplyChainRepository;
import com.supplyguard.core.strategy.TimeWindowStrategy;
import com.supplyguard.core.strategy.TradeRouteStrategy;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Route and transport risk: trade-route scoring of each equipment route, plus
 * the route between the first two countries named, blended evenly with
 * time-windowed logistics and natural-disaster news.
 */
@Component
public class LogisticsAgent extends AbstractRiskAgent {

    static final int CONGESTION_EVENT_COUNT = 2;

    private final SupplyChainRepository repository;
    private final TradeRouteStrategy tradeRoute;
    private final TimeWindowStrategy timeWindow;
    private final RiskProperties riskProperties;

    public LogisticsAgent(SupplyChainRepository repository, TradeRouteStrategy tradeRoute,
                          TimeWindowStrategy timeWindow, RiskProperties riskProperties,
                          AiRiskAdapter aiAdapter, RiskAggregator aggregator,
                          SupplyGuardMetrics metrics, Clock clock) {
        super(aiAdapter, aggregator, metrics, clock);
        this.repository = repository;
        this.tradeRoute = tradeRoute;
        this.timeWindow = timeWindow;
        this.riskProperties = riskProperties;
    }

    @Override
    public AgentRole role() {
        return AgentRole.LOGISTICS;
    }

    @Override
    public AgentCapability capability() {
        return new AgentCapability(role().name(), role().agentName(),
                "Evaluates shipping routes, port conditions and transport disruptions",
                List.of("trade route risk", "alternative routes", "port congestion", "disruption trends"),
                List.of("What are the logistics risks for our shipments?",
                        "Are there port delays affecting cargo from Taiwan?",
                        "Which transport routes are the riskiest?"));
    }

    @Override
    public RiskScore analyze(AgentContext context) {
        var filter = filterFor(context);
        List<Equipment> equipment = repository.findEquipment(filter);
        List<NewsEvent> events = repository.findNewsEvents(
                EnumSet.of(NewsCategory.LOGISTICS, NewsCategory.NATURAL_DISASTER), filter);

        var routeSet = new LinkedHashSet<TradeRoute>();
        var countries = context.intent().entities().countries();
        if (countries.size() >= 2) {
            routeSet.add(TradeRoute.direct(countries.get(0), countries.get(1)));
        }
        equipment.forEach(e -> routeSet.add(e.route()));
        var routes = new ArrayList<TradeRoute>(routeSet);
        if (routes.isEmpty() && events.isEmpty()) {
            return RiskScore.insufficientData(RiskDimension.LOGISTICS, "no equipment routes or logistics events");
        }

        var details = new LinkedHashMap<String, Object>();
        var conditions = EnumSet.noneOf(RiskCondition.class);
        var recommendations = new ArrayList<String>();
        double sum = 0.0;
        int parts = 0;

        if (!routes.isEmpty()) {
            RiskScore routeScore = tradeRoute.scoreRoutes(RiskDimension.LOGISTICS, routes);
            sum += routeScore.score();
            parts++;
            details.put("route_score", routeScore.score());
            details.put("route_scores", routeScore.details().get("route_scores"));
            if (routeScore.hasCondition(RiskCondition.UNKNOWN_ENTITY)) {
                conditions.add(RiskCondition.UNKNOWN_ENTITY);
                details.put("unknown_countries", routeScore.details().get("unknown_countries"));
            }
            TradeRoute riskiest = routes.stream()
                    .max(Comparator.comparingDouble(r -> tradeRoute.score(RiskDimension.LOGISTICS, r).score()))
                    .orElseThrow();
            var alternatives = tradeRoute.alternatives(riskiest, 3).stream().map(TradeRoute::describe).toList();
            details.put("riskiest_route", riskiest.describe());
            details.put("alternative_routes", alternatives);
            if (tradeRoute.score(RiskDimension.LOGISTICS, riskiest).score() >= riskProperties.getLevels().getHigh()
                    && !alternatives.isEmpty()) {
                recommendations.add("Consider rerouting " + riskiest.describe() + " via " + alternatives.get(0));
            }
            recommendations.add("Pay particular attention to logistics on " + riskiest.describe());
        }

        if (!events.isEmpty()) {
            RiskScore window = timeWindow.score(RiskDimension.LOGISTICS, events, List.of());
            sum += window.score();
            parts++;
            details.put("time_window_score", window.score());
            details.put("trend", window.details().get("trend"));
            List<String> congested = congestedCountries(events);
            details.put("congested_countries", congested);
            if (!congested.isEmpty()) {
                recommendations.add("Book buffer capacity for shipments through " + String.join(", ", congested));
            }
        }
        details.put("recent_events", recentEventTitles(events));
        if (recommendations.isEmpty()) {
            recommendations.add("Keep monitoring transport conditions on active routes");
        }

        double score = sum / parts;
        String summary = String.format("%d route(s) and %d logistics event(s) reviewed; logistics risk %.1f",
                routes.size(), events.size(), score);
        var traditional = new RiskScore(RiskDimension.LOGISTICS, score, riskProperties.getLevels().levelFor(score),
                summary, recommendations, Provenance.TRADITIONAL,
                conditions.isEmpty() ? 0.8 : 0.6, conditions, null, details);

        var prompt = new LinkedHashMap<String, String>();
        prompt.put("Trade routes", String.join("; ", routes.stream().map(TradeRoute::describe).toList()));
        prompt.put("Recent logistics events", String.join("; ", recentEventTitles(events)));
        return assessWithAi(context, traditional, prompt);
    }

    private static List<String> congestedCountries(List<NewsEvent> events) {
        Map<String, Integer> counts = new TreeMap<>();
        for (var e : events) {
            if (e.country() != null) {
                counts.merge(e.country(), 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
                .filter(en -> en.getValue() >= CONGESTION_EVENT_COUNT)
                .map(Map.Entry::getKey)
                .toList();
    }
}
