package com.supplyguard.core.llm;

import com.supplyguard.core.config.RiskProperties;
import com.supplyguard.core.model.Provenance;
import com.supplyguard.core.model.RiskDimension;
import com.supplyguard.core.model.RiskLevel;
import com.supplyguard.core.model.RiskScore;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Remote risk reasoning with a per-attempt timeout, bounded exponential-backoff
 * retries, and an explicit unavailable result instead of an exception.
 *
 * <p>Every attempt goes through the {@link RateLimitedExecutor}. A rejection for
 * lack of a slot is not retried, since waiting again would only stretch the
 * caller's deadline.
 */
@Service
public class AiRiskAdapter {

    private static final Logger log = LoggerFactory.getLogger(AiRiskAdapter.class);

    private final LlmService llmService;
    private final RateLimitedExecutor executor;
    private final AiProperties properties;
    private final RiskProperties riskProperties;
    private final Retry retry;

    public AiRiskAdapter(LlmService llmService, RateLimitedExecutor executor,
                         AiProperties properties, RiskProperties riskProperties) {
        this.llmService = llmService;
        this.executor = executor;
        this.properties = properties;
        this.riskProperties = riskProperties;
        this.retry = Retry.of("ai-provider", RetryConfig.custom()
                .maxAttempts(properties.getMaxRetries() + 1)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        properties.getInitialBackoff(), properties.getBackoffMultiplier()))
                .retryOnException(e -> !(e instanceof RateLimitExceededException)
                        && !Thread.currentThread().isInterrupted())
                .build());
    }

    public AiCallResult invoke(String userPrompt, RiskDimension analysisType) {
        return invoke(userPrompt, analysisType, properties.getTimeout());
    }

    /**
     * Asks the model for a risk assessment of {@code analysisType}.
     *
     * @param timeout per-attempt timeout
     * @return a score on success, otherwise {@link AiCallResult#unavailable(String)}
     */
    public AiCallResult invoke(String userPrompt, RiskDimension analysisType, Duration timeout) {
        if (!properties.isEnabled()) {
            return AiCallResult.unavailable("AI analysis disabled");
        }
        var request = new AiRequest(
                AiPrompts.systemPrompt(analysisType),
                userPrompt + "\n\n" + llmService.formatInstructions(AiRiskAssessment.class),
                properties.getModel(),
                properties.getTemperature(),
                properties.getMaxTokens());
        long start = System.currentTimeMillis();
        try {
            String raw = retry.executeCallable(() -> executor.call(() -> llmService.complete(request), timeout));
            log.debug("AI {} analysis answered in {} ms", analysisType.wireName(), System.currentTimeMillis() - start);
            return AiCallResult.success(toScore(raw, analysisType));
        } catch (Exception e) {
            log.warn("AI {} analysis unavailable after {} ms: {}",
                    analysisType.wireName(), System.currentTimeMillis() - start, e.getMessage());
            return AiCallResult.unavailable(e.getMessage());
        }
    }

    /**
     * Free-text answer for general questions; no structured parsing.
     */
    public AiCallResult answer(String question) {
        if (!properties.isEnabled()) {
            return AiCallResult.unavailable("AI analysis disabled");
        }
        var request = new AiRequest(AiPrompts.systemPrompt(RiskDimension.GENERAL), question,
                properties.getModel(), properties.getTemperature(), properties.getMaxTokens());
        try {
            String raw = retry.executeCallable(
                    () -> executor.call(() -> llmService.complete(request), properties.getTimeout()));
            return AiCallResult.success(new RiskScore(RiskDimension.GENERAL, 0.0, RiskLevel.LOW, raw.trim(),
                    List.of(), Provenance.AI, 0.75, Set.of(), null, Map.of()));
        } catch (Exception e) {
            log.warn("AI assistant answer unavailable: {}", e.getMessage());
            return AiCallResult.unavailable(e.getMessage());
        }
    }

    RiskScore toScore(String raw, RiskDimension dimension) {
        AiRiskAssessment assessment;
        try {
            assessment = llmService.parse(raw, AiRiskAssessment.class);
        } catch (LlmParseException e) {
            log.debug("Structured parse failed, reading {} answer as free text", dimension.wireName());
            return FreeTextRiskParser.parse(raw, dimension);
        }
        if (assessment == null || assessment.riskScore() == null) {
            return FreeTextRiskParser.parse(raw, dimension);
        }

        double score = assessment.riskScore();
        double confidence = assessment.confidence() == null ? 0.75 : assessment.confidence();
        if (confidence > 1.0) {
            confidence = confidence / 100.0;
        }
        var details = new LinkedHashMap<String, Object>();
        if (assessment.riskLevel() != null) {
            details.put("ai_reported_level", assessment.riskLevel());
        }
        if (assessment.keyFindings() != null && !assessment.keyFindings().isEmpty()) {
            details.put("key_findings", assessment.keyFindings());
        }
        if (assessment.affectedAreas() != null && !assessment.affectedAreas().isEmpty()) {
            details.put("affected_areas", assessment.affectedAreas());
        }
        String summary = assessment.summary() == null || assessment.summary().isBlank() ? raw : assessment.summary();
        return new RiskScore(dimension, score, riskProperties.getLevels().levelFor(score), summary,
                assessment.recommendations(), Provenance.AI, confidence, Set.of(), null, details);
    }
}
