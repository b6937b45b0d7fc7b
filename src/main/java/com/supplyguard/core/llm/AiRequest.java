package com.supplyguard.core.llm;

/**
 * One provider request.
 */
public record AiRequest(
    String systemPrompt,
    String userPrompt,
    String model,
    double temperature,
    int maxTokens
) {}
