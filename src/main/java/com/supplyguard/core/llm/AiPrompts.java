package com.supplyguard.core.llm;

import com.supplyguard.core.model.RiskDimension;

import java.util.EnumMap;
import java.util.Map;

/**
 * System prompts per analysis type and the user prompt layout.
 */
public final class AiPrompts {

    private static final Map<RiskDimension, String> SYSTEM_PROMPTS = new EnumMap<>(RiskDimension.class);

    static {
        SYSTEM_PROMPTS.put(RiskDimension.SCHEDULING,
                "You are a supply chain scheduling risk analyst. Analyze equipment delivery schedules and identify "
                + "potential risks, delays, and bottlenecks. Provide risk scores (0-100) and actionable recommendations.");
        SYSTEM_PROMPTS.put(RiskDimension.POLITICAL,
                "You are a geopolitical risk analyst specializing in supply chain impacts. Analyze political events, "
                + "policy changes, and their potential effects on supply chain operations. Provide risk assessments "
                + "and mitigation strategies.");
        SYSTEM_PROMPTS.put(RiskDimension.LOGISTICS,
                "You are a logistics and transportation risk analyst. Evaluate shipping routes, port conditions, "
                + "transportation disruptions, and logistics infrastructure risks. Provide route-specific risk assessments.");
        SYSTEM_PROMPTS.put(RiskDimension.TARIFF,
                "You are a trade policy and tariff analyst. Analyze trade wars, tariff changes, customs regulations, "
                + "and their impact on supply chain costs and operations. Provide cost impact assessments.");
        SYSTEM_PROMPTS.put(RiskDimension.GENERAL,
                "You are a helpful supply chain risk assistant. Answer the user's question concisely and explain which "
                + "kinds of risk analysis (scheduling, political, logistics, tariff) could help them.");
        SYSTEM_PROMPTS.put(RiskDimension.OVERALL,
                "You are a comprehensive supply chain risk analyst. Provide holistic risk assessment covering "
                + "scheduling, political, logistics, and tariff factors.");
    }

    private AiPrompts() {}

    public static String systemPrompt(RiskDimension type) {
        return SYSTEM_PROMPTS.getOrDefault(type, SYSTEM_PROMPTS.get(RiskDimension.OVERALL));
    }

    /**
     * Query followed by one "key: value" line per context entry.
     */
    public static String userPrompt(String query, Map<String, String> context) {
        var sb = new StringBuilder();
        sb.append("Analysis request: ").append(query == null ? "" : query).append("\n\n");
        if (context != null && !context.isEmpty()) {
            sb.append("Context:\n");
            context.forEach((k, v) -> sb.append("- ").append(k).append(": ").append(v).append('\n'));
        }
        sb.append("\nRespond with a JSON object containing risk_level (low, medium, high or critical), ")
                .append("risk_score (0-100), summary, key_findings, recommendations, affected_areas and confidence (0-100).");
        return sb.toString();
    }
}
