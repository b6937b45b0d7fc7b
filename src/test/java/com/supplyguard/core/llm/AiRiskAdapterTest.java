package com.supplyguard.core.llm;

import com.supplyguard.core.config.RiskProperties;
import com.supplyguard.core.metrics.SupplyGuardMetrics;
import com.supplyguard.core.model.Provenance;
import com.supplyguard.core.model.RiskCondition;
import com.supplyguard.core.model.RiskDimension;
import com.supplyguard.core.model.RiskLevel;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class AiRiskAdapterTest {

    private LlmService llmService;
    private AiProperties properties;
    private RateLimitedExecutor executor;
    private AiRiskAdapter adapter;

    @BeforeEach
    void setUp() {
        llmService = mock(LlmService.class);
        when(llmService.formatInstructions(any())).thenReturn("Respond in JSON.");
        properties = new AiProperties();
        properties.setTimeout(Duration.ofMillis(100));
        properties.setMaxRetries(2);
        properties.setInitialBackoff(Duration.ofMillis(10));
        properties.setBackoffMultiplier(2.0);
        executor = new RateLimitedExecutor(2, Duration.ofMillis(100),
                new SupplyGuardMetrics(new SimpleMeterRegistry()));
        adapter = new AiRiskAdapter(llmService, executor, properties, new RiskProperties());
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    @DisplayName("disabled AI reports unavailable without calling the provider")
    void disabled() {
        properties.setEnabled(false);

        var result = adapter.invoke("prompt", RiskDimension.TARIFF);

        assertFalse(result.isAvailable());
        assertTrue(result.unavailableReason().contains("disabled"));
        verify(llmService, never()).complete(any());
    }

    @Test
    @DisplayName("structured answer becomes an AI score")
    void structuredAnswer() {
        var assessment = new AiRiskAssessment("high", 72.0, "Strikes at major ports", List.of("port strikes"),
                List.of("Reroute via Singapore"), List.of("logistics"), 80.0);
        when(llmService.complete(any())).thenReturn("{json}");
        when(llmService.parse(eq("{json}"), eq(AiRiskAssessment.class))).thenReturn(assessment);

        var result = adapter.invoke("prompt", RiskDimension.LOGISTICS);

        assertTrue(result.isAvailable());
        var score = result.score();
        assertEquals(Provenance.AI, score.provenance());
        assertEquals(72.0, score.score());
        assertEquals(RiskLevel.HIGH, score.level());
        assertEquals(0.8, score.confidence(), 1e-9);
        assertEquals(List.of("Reroute via Singapore"), score.recommendations());
        assertEquals(List.of("port strikes"), score.details().get("key_findings"));
    }

    @Test
    @DisplayName("unparseable answer falls back to free-text reading")
    void freeTextFallback() {
        when(llmService.complete(any())).thenReturn("Risk is high. You should diversify.");
        when(llmService.parse(anyString(), eq(AiRiskAssessment.class)))
                .thenThrow(new LlmParseException("not json", new IllegalArgumentException()));

        var result = adapter.invoke("prompt", RiskDimension.POLITICAL);

        assertTrue(result.isAvailable());
        assertTrue(result.score().hasCondition(RiskCondition.FREE_TEXT_RESPONSE));
        assertEquals(RiskLevel.HIGH, result.score().level());
        assertEquals(List.of("Risk is high. You should diversify."), result.score().recommendations());
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("transient errors are retried")
        void retriesThenSucceeds() {
            when(llmService.complete(any()))
                    .thenThrow(new RuntimeException("503"))
                    .thenReturn("{json}");
            when(llmService.parse(anyString(), eq(AiRiskAssessment.class)))
                    .thenReturn(new AiRiskAssessment("low", 10.0, "Fine", null, null, null, null));

            var result = adapter.invoke("prompt", RiskDimension.SCHEDULING);

            assertTrue(result.isAvailable());
            verify(llmService, times(2)).complete(any());
        }

        @Test
        @DisplayName("exhausted retries report unavailable")
        void exhaustedRetries() {
            when(llmService.complete(any())).thenThrow(new RuntimeException("503"));

            var result = adapter.invoke("prompt", RiskDimension.SCHEDULING);

            assertFalse(result.isAvailable());
            verify(llmService, times(3)).complete(any());
        }

        @Test
        @DisplayName("a hanging provider is abandoned within the worst-case latency")
        void timeoutIsBounded() {
            when(llmService.complete(any())).thenAnswer(inv -> {
                Thread.sleep(10_000);
                return "never";
            });

            long start = System.currentTimeMillis();
            var result = adapter.invoke("prompt", RiskDimension.TARIFF);
            long elapsed = System.currentTimeMillis() - start;

            assertFalse(result.isAvailable());
            assertTrue(elapsed < properties.worstCaseLatency().toMillis() + 1_000,
                    "took " + elapsed + " ms");
        }
    }

    @Test
    @DisplayName("answer returns the model text for general questions")
    void answer() {
        when(llmService.complete(any())).thenReturn("  I can analyze schedules and tariffs.  ");

        var result = adapter.answer("Hello");

        assertTrue(result.isAvailable());
        assertEquals("I can analyze schedules and tariffs.", result.score().summary());
        assertEquals(RiskDimension.GENERAL, result.score().dimension());
    }

    @Test
    @DisplayName("worst-case latency adds every attempt and backoff")
    void worstCaseLatency() {
        // 3 attempts x 100 ms + 10 ms + 20 ms backoff
        assertEquals(Duration.ofMillis(330), properties.worstCaseLatency());
    }
}
