package com.supplyguard.core.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Structured answer requested from the model.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AiRiskAssessment(
    @JsonProperty("risk_level") String riskLevel,
    @JsonProperty("risk_score") Double riskScore,
    @JsonProperty("summary") String summary,
    @JsonProperty("key_findings") List<String> keyFindings,
    @JsonProperty("recommendations") List<String> recommendations,
    @JsonProperty("affected_areas") List<String> affectedAreas,
    @JsonProperty("confidence") Double confidence
) {}
