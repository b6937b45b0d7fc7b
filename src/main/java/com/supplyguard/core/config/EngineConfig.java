package com.supplyguard.core.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Infrastructure beans shared by the agents and the orchestration graph.
 */
@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Worker pool for agents of one tier. Sized independently of the AI
     * concurrency ceiling, which the rate-limited executor enforces.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService agentExecutor(PipelineProperties properties) {
        var counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, properties.getAgentThreads()), r -> {
            Thread t = new Thread(r, "agent-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
