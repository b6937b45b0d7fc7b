package com.supplyguard.core.agents;

import com.supplyguard.core.config.RiskProperties;
import com.supplyguard.core.llm.AiRequest;
import com.supplyguard.core.llm.AiRiskAdapter;
import com.supplyguard.core.llm.LlmService;
import com.supplyguard.core.llm.RateLimitedExecutor;
import com.supplyguard.core.metrics.SupplyGuardMetrics;
import com.supplyguard.core.model.Provenance;
import com.supplyguard.core.model.RiskCondition;
import com.supplyguard.core.model.RiskDimension;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;

import static com.supplyguard.core.TestFixtures.context;
import static com.supplyguard.core.TestFixtures.disabledAi;
import static com.supplyguard.core.TestFixtures.fastAi;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AssistantAgentTest {

    private final LlmService llmService = mock(LlmService.class);
    private final RateLimitedExecutor executor = new RateLimitedExecutor(1, Duration.ofMillis(200),
            new SupplyGuardMetrics(new SimpleMeterRegistry()));

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    @DisplayName("without AI the agent explains what can be asked")
    void helpTextWhenAiDisabled() {
        var agent = new AssistantAgent(new AiRiskAdapter(llmService, executor, disabledAi(), new RiskProperties()));

        var score = agent.analyze(context("Hello, can you help me?", RiskDimension.GENERAL, List.of()));

        assertEquals(RiskDimension.GENERAL, score.dimension());
        assertEquals(AssistantAgent.HELP_TEXT, score.summary());
        assertEquals(Provenance.TRADITIONAL_FALLBACK, score.provenance());
        assertTrue(score.hasCondition(RiskCondition.AI_UNAVAILABLE));
        verifyNoInteractions(llmService);
    }

    @Test
    @DisplayName("with AI the model's answer is returned as the summary")
    void aiAnswer() {
        when(llmService.complete(any())).thenReturn("  Happy to help with supply chain questions.  ");
        var agent = new AssistantAgent(new AiRiskAdapter(llmService, executor, fastAi(), new RiskProperties()));

        var score = agent.analyze(context("Hello, can you help me?", RiskDimension.GENERAL, List.of()));

        assertEquals("Happy to help with supply chain questions.", score.summary());
        assertEquals(Provenance.AI, score.provenance());
        assertEquals(0.0, score.score());

        ArgumentCaptor<AiRequest> captor = ArgumentCaptor.forClass(AiRequest.class);
        verify(llmService).complete(captor.capture());
        assertEquals("Hello, can you help me?", captor.getValue().userPrompt());
    }
}
