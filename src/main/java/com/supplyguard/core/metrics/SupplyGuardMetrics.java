package com.supplyguard.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Micrometer meters for pipeline, agent and AI-call behaviour.
 */
@Service
public class SupplyGuardMetrics {

    private final MeterRegistry registry;

    public SupplyGuardMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPipelineDuration(String domain, long ms) {
        Timer.builder("supplyguard.pipeline.duration")
                .tag("domain", domain)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param outcome "closed", "truncated" or "failed"
     */
    public void recordPipelineResult(String outcome) {
        Counter.builder("supplyguard.pipeline.completed")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordAgentExecution(String agent, String status, long ms) {
        Timer.builder("supplyguard.agent.duration")
                .tag("agent", agent)
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordAiFallback(String dimension, String reason) {
        Counter.builder("supplyguard.ai.fallbacks")
                .description("Agent results that fell back to traditional scoring")
                .tag("dimension", dimension)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordRateLimitRejection() {
        Counter.builder("supplyguard.ai.rate_limited")
                .description("AI calls rejected after waiting too long for a slot")
                .register(registry)
                .increment();
    }

    public void registerInFlightGauge(Supplier<Number> inFlight) {
        Gauge.builder("supplyguard.ai.in_flight", inFlight)
                .description("AI calls currently holding a concurrency slot")
                .register(registry);
    }
}
