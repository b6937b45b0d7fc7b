package com.supplyguard.core.strategy;

import com.supplyguard.core.config.RiskProperties;
import com.supplyguard.core.model.Provenance;
import com.supplyguard.core.model.RiskCondition;
import com.supplyguard.core.model.RiskDimension;
import com.supplyguard.core.model.RiskScore;
import com.supplyguard.core.model.TradeRoute;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Route risk from the configured per-country base scores.
 *
 * <p>A route scores the worst of its countries, scaled up by
 * {@code 1 + step * transitCount}. Countries missing from the table are never
 * defaulted: the score carries {@link RiskCondition#UNKNOWN_ENTITY} and lists them
 * under {@code unknown_countries}, and only known countries contribute.
 */
@Component
public class TradeRouteStrategy {

    private final RiskProperties properties;

    public TradeRouteStrategy(RiskProperties properties) {
        this.properties = properties;
    }

    public OptionalDouble countryRisk(String country) {
        Double value = properties.getCountryRisk().get(properties.canonicalCountry(country));
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public boolean isKnown(String country) {
        return countryRisk(country).isPresent();
    }

    public RiskScore score(RiskDimension dimension, TradeRoute route) {
        if (route == null) {
            return RiskScore.insufficientData(dimension, "no trade route");
        }
        var countries = new ArrayList<String>();
        countries.add(route.origin());
        countries.add(route.destination());
        countries.addAll(route.transits());

        double worst = 0.0;
        int known = 0;
        var unknown = new LinkedHashSet<String>();
        for (String c : countries) {
            var risk = countryRisk(c);
            if (risk.isPresent()) {
                worst = Math.max(worst, risk.getAsDouble());
                known++;
            } else {
                unknown.add(c == null ? "<missing>" : c);
            }
        }

        double factor = 1.0 + properties.getTransitComplexityStep() * route.transits().size();
        double score = Math.min(100.0, worst * factor);
        var details = new LinkedHashMap<String, Object>();
        details.put("route", route.describe());
        details.put("base_risk", worst);
        details.put("complexity_factor", factor);

        var conditions = EnumSet.noneOf(RiskCondition.class);
        double confidence = 0.8;
        String summary = String.format("Route %s scores %.1f", route.describe(), score);
        if (!unknown.isEmpty()) {
            conditions.add(RiskCondition.UNKNOWN_ENTITY);
            details.put("unknown_countries", List.copyOf(unknown));
            confidence = known == 0 ? 0.0 : 0.8 * known / countries.size();
            summary = known == 0
                    ? "Route " + route.describe() + " has no countries with a known risk profile"
                    : summary + " (unknown: " + String.join(", ", unknown) + ")";
        }
        return new RiskScore(dimension, score, properties.getLevels().levelFor(score), summary, List.of(),
                Provenance.TRADITIONAL, confidence, conditions, null, details);
    }

    /**
     * Average over several routes. Unknown countries from any route are merged
     * into a single {@code unknown_countries} list.
     */
    public RiskScore scoreRoutes(RiskDimension dimension, List<TradeRoute> routes) {
        if (routes == null || routes.isEmpty()) {
            return RiskScore.insufficientData(dimension, "no trade routes");
        }
        double sum = 0.0;
        double confidence = 0.0;
        var unknown = new LinkedHashSet<String>();
        var perRoute = new LinkedHashMap<String, Object>();
        for (var route : routes) {
            var s = score(dimension, route);
            sum += s.score();
            confidence += s.confidence();
            perRoute.put(route.describe(), s.score());
            if (s.hasCondition(RiskCondition.UNKNOWN_ENTITY)) {
                @SuppressWarnings("unchecked")
                var u = (List<String>) s.details().get("unknown_countries");
                unknown.addAll(u);
            }
        }
        double score = sum / routes.size();
        var details = new LinkedHashMap<String, Object>();
        details.put("route_scores", perRoute);
        var conditions = EnumSet.noneOf(RiskCondition.class);
        if (!unknown.isEmpty()) {
            conditions.add(RiskCondition.UNKNOWN_ENTITY);
            details.put("unknown_countries", List.copyOf(unknown));
        }
        String summary = String.format("%d trade route(s), average route risk %.1f", routes.size(), score);
        return new RiskScore(dimension, score, properties.getLevels().levelFor(score), summary, List.of(),
                Provenance.TRADITIONAL, confidence / routes.size(), conditions, null, details);
    }

    /**
     * Single-transit routes through the configured hubs, lowest risk first.
     * Hubs equal to the route's own endpoints are skipped.
     */
    public List<TradeRoute> alternatives(TradeRoute route, int limit) {
        var candidates = new ArrayList<TradeRoute>();
        String origin = properties.canonicalCountry(route.origin());
        String destination = properties.canonicalCountry(route.destination());
        for (String hub : properties.getAlternativeHubs()) {
            String canonicalHub = properties.canonicalCountry(hub);
            if (canonicalHub.equals(origin) || canonicalHub.equals(destination)) {
                continue;
            }
            candidates.add(new TradeRoute(route.origin(), route.destination(), List.of(canonicalHub)));
        }
        candidates.sort((a, b) -> Double.compare(
                score(RiskDimension.LOGISTICS, a).score(), score(RiskDimension.LOGISTICS, b).score()));
        return candidates.size() > limit ? List.copyOf(candidates.subList(0, limit)) : List.copyOf(candidates);
    }
}
