package com.supplyguard.core.agents;

import com.supplyguard.core.llm.AiRiskAdapter;
import com.supplyguard.core.model.AgentRole;
import com.supplyguard.core.model.Provenance;
import com.supplyguard.core.model.RiskCondition;
import com.supplyguard.core.model.RiskDimension;
import com.supplyguard.core.model.RiskLevel;
import com.supplyguard.core.model.RiskScore;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Answers queries that match no risk domain. With the AI available the answer
 * is the model's; otherwise the caller gets a description of what can be asked.
 */
@Component
public class AssistantAgent implements RiskAgent {

    static final String HELP_TEXT = String.join("\n",
            "I can analyze supply chain risk for your equipment. Try asking about:",
            "  - schedules: \"What are the schedule risks for our robotics deliveries?\"",
            "  - political risk: \"How do sanctions on Russia affect our suppliers?\"",
            "  - logistics: \"Are there shipping delays at European ports?\"",
            "  - tariffs: \"How will new tariffs on China change our import costs?\"",
            "Add a country, an equipment type or a time window such as \"last 30 days\" to narrow the analysis.");

    private final AiRiskAdapter aiAdapter;

    public AssistantAgent(AiRiskAdapter aiAdapter) {
        this.aiAdapter = aiAdapter;
    }

    @Override
    public AgentRole role() {
        return AgentRole.ASSISTANT;
    }

    @Override
    public AgentCapability capability() {
        return new AgentCapability(role().name(), role().agentName(),
                "Answers general supply chain questions and explains what the analysts can do",
                List.of("general questions", "capability overview"),
                List.of("Hello, can you help me?", "What kinds of risk can you analyze?"));
    }

    @Override
    public RiskScore analyze(AgentContext context) {
        var result = aiAdapter.answer(context.query().text());
        if (result.isAvailable()) {
            return result.score();
        }
        return new RiskScore(RiskDimension.GENERAL, 0.0, RiskLevel.LOW, HELP_TEXT,
                List.of(), Provenance.TRADITIONAL_FALLBACK, 0.5, Set.of(RiskCondition.AI_UNAVAILABLE), null,
                Map.of("ai_unavailable_reason", String.valueOf(result.unavailableReason())));
    }
}
