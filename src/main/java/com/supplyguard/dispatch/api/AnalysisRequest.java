package com.supplyguard.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/analysis.
 *
 * @param query          natural-language risk question
 * @param country        optional country hint; nullable
 * @param equipmentType  optional equipment category hint; nullable
 * @param timeWindowDays optional look-back window in days; nullable
 * @param threadId       optional caller-chosen thread id, so the event stream
 *                       for the thread can be opened before posting; nullable
 */
public record AnalysisRequest(
    String query,
    String country,
    @JsonProperty("equipment_type") String equipmentType,
    @JsonProperty("time_window_days") Integer timeWindowDays,
    @JsonProperty("thread_id") String threadId
) {

    public AnalysisRequest(String query, String country, String equipmentType, Integer timeWindowDays) {
        this(query, country, equipmentType, timeWindowDays, null);
    }
}
