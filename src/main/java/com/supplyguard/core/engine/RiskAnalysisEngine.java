package com.supplyguard.core.engine;

import com.supplyguard.core.config.PipelineProperties;
import com.supplyguard.core.events.EventBus;
import com.supplyguard.core.events.RiskEvent;
import com.supplyguard.core.graph.AnalysisGraph;
import com.supplyguard.core.logging.MdcContext;
import com.supplyguard.core.metrics.SupplyGuardMetrics;
import com.supplyguard.core.model.AgentRole;
import com.supplyguard.core.model.ConversationThread;
import com.supplyguard.core.model.Query;
import com.supplyguard.core.model.QueryContext;
import com.supplyguard.core.model.RiskDimension;
import com.supplyguard.core.model.ThreadStatus;
import com.supplyguard.core.state.AnalysisState;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one query through the analysis graph and returns the sealed thread.
 * <p>
 * Threads are independent: the engine keeps no per-query state beyond the id
 * counter, so concurrent callers each get their own graph invocation.
 */
@Service
public class RiskAnalysisEngine {

    private static final Logger log = LoggerFactory.getLogger(RiskAnalysisEngine.class);
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger(0);

    private final AnalysisGraph analysisGraph;
    private final PipelineProperties properties;
    private final EventBus eventBus;
    private final SupplyGuardMetrics metrics;
    private final Clock clock;

    public RiskAnalysisEngine(AnalysisGraph analysisGraph, PipelineProperties properties,
                              EventBus eventBus, SupplyGuardMetrics metrics, Clock clock) {
        this.analysisGraph = analysisGraph;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
    }

    /** Domains covered by a country risk profile. */
    static final List<RiskDimension> COUNTRY_PROFILE_DOMAINS =
            List.of(RiskDimension.POLITICAL, RiskDimension.LOGISTICS, RiskDimension.TARIFF);

    public ConversationThread analyze(Query query) {
        return analyze(generateThreadId(), query);
    }

    /**
     * Blank or missing query text is classified as general and answered by
     * the assistant.
     *
     * @throws PipelineFailedException when classification or storage failed
     */
    public ConversationThread analyze(String threadId, Query query) {
        return run(threadId, query, Map.of());
    }

    /**
     * Runs one agent on its own, skipping keyword routing and the report.
     * Entities are still extracted from the query text and context; blank text
     * gets a generic prompt for the agent's dimension.
     *
     * @throws IllegalArgumentException for the reporting role, which only
     *         summarises other agents
     */
    public ConversationThread analyzeWith(AgentRole role, Query query) {
        if (role == AgentRole.REPORTING) {
            throw new IllegalArgumentException("The reporting agent cannot run on its own");
        }
        Query effective = query;
        if (role != AgentRole.ASSISTANT && (query == null || query.text().isBlank())) {
            effective = new Query("Assess " + role.dimension().wireName() + " risk",
                    query == null ? null : query.context());
        }
        return run(generateThreadId(), effective, Map.of("targetRole", role.name()));
    }

    /**
     * Political, logistics and tariff risk for one country, closed by the report.
     */
    public ConversationThread analyzeCountry(String country, Integer timeWindowDays) {
        if (country == null || country.isBlank()) {
            throw new IllegalArgumentException("country is required");
        }
        var query = new Query("Risk profile for " + country.trim(),
                new QueryContext(country.trim(), null, timeWindowDays));
        return run(generateThreadId(), query, Map.of("targetDomains",
                COUNTRY_PROFILE_DOMAINS.stream().map(Enum::name).toList()));
    }

    private ConversationThread run(String threadId, Query requested, Map<String, Object> routing) {
        Query query = requested == null ? Query.of("") : requested;
        MdcContext.setThread(threadId);
        Instant startedAt = clock.instant();
        long startMs = System.currentTimeMillis();
        try {
            log.info("Starting thread {}: {}", threadId, query.text());
            eventBus.publish(new RiskEvent("thread.started", threadId, null,
                    Map.of("query", query.text()), Instant.now()));

            var stateMap = new HashMap<String, Object>();
            stateMap.put("threadId", threadId);
            stateMap.put("query", query);
            stateMap.put("status", ThreadStatus.STARTED.name());
            stateMap.put("deadlineEpochMs", startMs + properties.getPipelineTimeout().toMillis());
            stateMap.put("transitions", List.of(ThreadStatus.STARTED.name()));
            stateMap.putAll(routing);

            var config = RunnableConfig.builder()
                    .threadId(threadId)
                    .build();
            AnalysisState state;
            try {
                state = analysisGraph.getCompiledGraph()
                        .invoke(Map.copyOf(stateMap), config)
                        .orElseThrow(() -> new PipelineFailedException(threadId,
                                "Graph execution returned empty state for thread " + threadId));
            } catch (PipelineFailedException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new PipelineFailedException(threadId, "Pipeline execution failed: " + e.getMessage(), e);
            }

            long elapsed = System.currentTimeMillis() - startMs;
            String domain = state.intent().map(i -> i.primaryDomain()).orElse(RiskDimension.GENERAL).wireName();
            metrics.recordPipelineDuration(domain, elapsed);

            if (state.status() == ThreadStatus.FAILED) {
                metrics.recordPipelineResult("failed");
                eventBus.publish(new RiskEvent("thread.failed", threadId, null,
                        Map.of("error", state.fatalError()), Instant.now()));
                throw new PipelineFailedException(threadId, state.fatalError());
            }

            var thread = new ConversationThread(threadId, query, state.intent().orElse(null),
                    state.invocations(), state.finalScore().orElse(null), state.status(),
                    state.truncated(), state.transitions(), startedAt, clock.instant());
            metrics.recordPipelineResult(thread.truncated() ? "truncated" : "closed");
            eventBus.publish(new RiskEvent("thread.closed", threadId, null,
                    Map.of("pipeline", thread.pipeline().stream().map(Enum::name).toList(),
                           "truncated", thread.truncated(),
                           "elapsedMs", elapsed),
                    Instant.now()));
            log.info("Thread {} closed in {} ms, pipeline {}", threadId, elapsed, thread.pipeline());
            return thread;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Unique thread id in the format SG-YYYY-NNNN.
     */
    public String generateThreadId() {
        int count = THREAD_COUNTER.incrementAndGet();
        int year = clock.instant().atZone(ZoneOffset.UTC).getYear();
        return String.format("SG-%d-%04d", year, count);
    }
}
