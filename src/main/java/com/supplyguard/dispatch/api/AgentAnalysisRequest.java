package com.supplyguard.dispatch.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.supplyguard.core.model.QueryContext;

/**
 * Inbound JSON body for POST /api/v1/analysis/agents/{agent}. Every field is
 * optional. Route endpoints ({@code origin_country}/{@code destination_country})
 * and trade-pair endpoints ({@code country1}/{@code country2}) share the
 * {@code country}/{@code counterpart_country} slots.
 */
public record AgentAnalysisRequest(
    String query,
    @JsonAlias({"origin_country", "country1"}) String country,
    @JsonProperty("counterpart_country") @JsonAlias({"destination_country", "country2"}) String counterpartCountry,
    @JsonProperty("equipment_id") String equipmentId,
    @JsonProperty("equipment_type") String equipmentType,
    @JsonProperty("time_window_days") Integer timeWindowDays
) {

    QueryContext context() {
        return new QueryContext(country, equipmentType, timeWindowDays, counterpartCountry, equipmentId);
    }
}
