package com.supplyguard.core.model;

import java.io.Serializable;

/**
 * A piece of equipment tracked through the supply chain.
 */
public record Equipment(
    String id,
    String name,
    String category,
    String manufacturer,
    String manufacturingCountry,
    String destinationCountry
) implements Serializable {

    public TradeRoute route() {
        return TradeRoute.direct(manufacturingCountry, destinationCountry);
    }
}
