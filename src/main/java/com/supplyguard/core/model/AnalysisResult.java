package com.supplyguard.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Caller-facing rendering of a closed {@link ConversationThread}, shared by the
 * CLI's JSON output and the REST API.
 */
public record AnalysisResult(
    @JsonProperty("thread_id") String threadId,
    @JsonProperty("agent_name") String agentName,
    @JsonProperty("analysis_type") String analysisType,
    @JsonProperty("risk_level") String riskLevel,
    @JsonProperty("risk_score") double riskScore,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("provenance") String provenance,
    @JsonProperty("summary") String summary,
    @JsonProperty("details") Map<String, Object> details,
    @JsonProperty("recommendations") List<String> recommendations,
    @JsonProperty("affected_equipment") List<String> affectedEquipment,
    @JsonProperty("recent_events") List<String> recentEvents,
    @JsonProperty("truncated") boolean truncated,
    @JsonProperty("invocations") List<InvocationSummary> invocations
) {

    public record InvocationSummary(
        @JsonProperty("agent_name") String agentName,
        @JsonProperty("status") String status,
        @JsonProperty("risk_score") double riskScore,
        @JsonProperty("provenance") String provenance,
        @JsonProperty("elapsed_ms") long elapsedMs,
        @JsonProperty("error") String error
    ) {}

    public static AnalysisResult from(ConversationThread thread) {
        var invocations = thread.invocations();
        RiskScore score = thread.finalScore();
        if (score == null) {
            score = RiskScore.insufficientData(RiskDimension.OVERALL, "no agent produced a result");
        }
        String agentName = invocations.isEmpty()
                ? AgentRole.REPORTING.agentName()
                : invocations.get(invocations.size() - 1).role().agentName();
        String analysisType = thread.intent() == null
                ? RiskDimension.GENERAL.wireName()
                : thread.intent().primaryDomain().wireName();

        var details = new LinkedHashMap<String, Object>(score.details());
        details.remove("affected_equipment");
        details.remove("recent_events");
        if (!score.conditions().isEmpty()) {
            details.put("conditions", score.conditionNames());
        }
        if (score.agreement() != null) {
            details.put("agreement", score.agreement().wireName());
        }

        var summaries = new ArrayList<InvocationSummary>();
        for (var inv : invocations) {
            summaries.add(new InvocationSummary(inv.role().agentName(), inv.status().name().toLowerCase(Locale.ROOT),
                    inv.score().score(), inv.score().provenance().wireName(), inv.elapsedMs(), inv.error()));
        }

        return new AnalysisResult(thread.threadId(), agentName, analysisType,
                score.level().wireName(), score.score(), score.confidence(), score.provenance().wireName(),
                score.summary(), details, score.recommendations(),
                strings(score.details().get("affected_equipment")),
                strings(score.details().get("recent_events")),
                thread.truncated(), summaries);
    }

    private static List<String> strings(Object value) {
        var list = new ArrayList<String>();
        if (value instanceof Collection<?> items) {
            items.forEach(item -> list.add(String.valueOf(item)));
        }
        return list;
    }
}
