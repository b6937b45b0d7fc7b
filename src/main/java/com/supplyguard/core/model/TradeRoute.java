package com.supplyguard.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Origin to destination, optionally through transit countries.
 */
public record TradeRoute(String origin, String destination, List<String> transits) implements Serializable {

    public TradeRoute {
        transits = transits == null ? List.of() : List.copyOf(transits);
    }

    public static TradeRoute direct(String origin, String destination) {
        return new TradeRoute(origin, destination, List.of());
    }

    public String describe() {
        var sb = new StringBuilder(String.valueOf(origin));
        for (String t : transits) {
            sb.append(" -> ").append(t);
        }
        return sb.append(" -> ").append(destination).toString();
    }
}
