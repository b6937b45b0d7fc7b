package com.supplyguard.core.nodes;

import com.supplyguard.core.agents.AgentRegistry;
import com.supplyguard.core.config.PipelineProperties;
import com.supplyguard.core.events.EventBus;
import com.supplyguard.core.events.RiskEvent;
import com.supplyguard.core.metrics.SupplyGuardMetrics;
import com.supplyguard.core.model.AgentInvocation;
import com.supplyguard.core.model.AgentRole;
import com.supplyguard.core.model.ExtractedEntities;
import com.supplyguard.core.model.Intent;
import com.supplyguard.core.model.InvocationStatus;
import com.supplyguard.core.model.Query;
import com.supplyguard.core.model.RiskCondition;
import com.supplyguard.core.model.RiskDimension;
import com.supplyguard.core.model.RiskLevel;
import com.supplyguard.core.model.RiskScore;
import com.supplyguard.core.model.ThreadStatus;
import com.supplyguard.core.routing.PipelinePlan;
import com.supplyguard.core.state.AnalysisState;
import com.supplyguard.core.storage.StorageUnavailableException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.supplyguard.core.TestFixtures.agent;
import static org.junit.jupiter.api.Assertions.*;

class RunAgentTierNodeTest {

    private ExecutorService executor;
    private PipelineProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private EventBus eventBus;
    private final List<RiskEvent> events = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        properties = new PipelineProperties();
        meterRegistry = new SimpleMeterRegistry();
        eventBus = new EventBus();
        eventBus.subscribeAll(events::add);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private RunAgentTierNode node(AgentRegistry registry) {
        return new RunAgentTierNode(registry, executor, properties, eventBus, new SupplyGuardMetrics(meterRegistry));
    }

    private static RiskScore score(RiskDimension dimension, double value) {
        return RiskScore.of(dimension, value, RiskLevel.MEDIUM, dimension.wireName() + " ok");
    }

    private static AnalysisState state(long deadlineEpochMs) {
        var intent = new Intent(List.of(RiskDimension.POLITICAL, RiskDimension.LOGISTICS),
                Map.of(RiskDimension.POLITICAL, 3, RiskDimension.LOGISTICS, 2),
                ExtractedEntities.none(), 0.4, List.of(AgentRole.POLITICAL, AgentRole.LOGISTICS, AgentRole.REPORTING));
        var init = new HashMap<String, Object>();
        init.put("threadId", "SG-2026-0007");
        init.put("query", Query.of("political and shipping risk"));
        init.put("intent", intent);
        init.put("plan", new PipelinePlan(List.of(List.of(AgentRole.POLITICAL, AgentRole.LOGISTICS)), true));
        init.put("tierIndex", 0);
        init.put("deadlineEpochMs", deadlineEpochMs);
        init.put("status", ThreadStatus.RUNNING.name());
        return new AnalysisState(init);
    }

    @SuppressWarnings("unchecked")
    private static List<AgentInvocation> invocations(Map<String, Object> result) {
        return (List<AgentInvocation>) result.get("invocations");
    }

    @Test
    @DisplayName("runs every agent in the tier and advances")
    void runsTier() {
        var registry = new AgentRegistry(List.of(
                agent(AgentRole.POLITICAL, ctx -> score(RiskDimension.POLITICAL, 40)),
                agent(AgentRole.LOGISTICS, ctx -> score(RiskDimension.LOGISTICS, 50))));

        var result = node(registry).apply(state(Long.MAX_VALUE));

        var invocations = invocations(result);
        assertEquals(2, invocations.size());
        assertEquals(AgentRole.POLITICAL, invocations.get(0).role());
        assertEquals(AgentRole.LOGISTICS, invocations.get(1).role());
        assertTrue(invocations.stream().allMatch(AgentInvocation::succeeded));
        assertEquals("political and shipping risk", invocations.get(0).input().get("query"));
        assertEquals(1, result.get("tierIndex"));
        assertFalse(result.containsKey("truncated"));
        assertFalse(result.containsKey("status"));

        assertEquals(2, events.stream().filter(e -> e.eventType().equals("agent.finished")).count());
        var timer = meterRegistry.find("supplyguard.agent.duration")
                .tag("agent", "LOGISTICS_AGENT").tag("status", "SUCCEEDED").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("an agent exception is recorded and the tier carries on")
    void agentFailure() {
        var registry = new AgentRegistry(List.of(
                agent(AgentRole.POLITICAL, ctx -> score(RiskDimension.POLITICAL, 40)),
                agent(AgentRole.LOGISTICS, ctx -> {
                    throw new IllegalStateException("routing table corrupt");
                })));

        var result = node(registry).apply(state(Long.MAX_VALUE));

        var logistics = invocations(result).get(1);
        assertEquals(InvocationStatus.FAILED, logistics.status());
        assertEquals("routing table corrupt", logistics.error());
        assertEquals(0.0, logistics.score().confidence());
        assertTrue(logistics.score().hasCondition(RiskCondition.AGENT_FAILURE));
        assertTrue(invocations(result).get(0).succeeded());
        assertFalse(result.containsKey("status"));
    }

    @Test
    @DisplayName("a storage failure fails the thread")
    void storageFailure() {
        var registry = new AgentRegistry(List.of(
                agent(AgentRole.POLITICAL, ctx -> {
                    throw new StorageUnavailableException("news store offline");
                }),
                agent(AgentRole.LOGISTICS, ctx -> score(RiskDimension.LOGISTICS, 50))));

        var result = node(registry).apply(state(Long.MAX_VALUE));

        assertEquals(ThreadStatus.FAILED.name(), result.get("status"));
        assertEquals("news store offline", result.get("fatalError"));
    }

    @Test
    @DisplayName("a slow agent times out and truncates the pipeline")
    void agentTimeout() {
        properties.setAgentTimeout(Duration.ofMillis(100));
        var registry = new AgentRegistry(List.of(
                agent(AgentRole.POLITICAL, ctx -> score(RiskDimension.POLITICAL, 40)),
                agent(AgentRole.LOGISTICS, ctx -> {
                    try {
                        Thread.sleep(5_000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return score(RiskDimension.LOGISTICS, 50);
                })));

        var result = node(registry).apply(state(Long.MAX_VALUE));

        var logistics = invocations(result).get(1);
        assertEquals(InvocationStatus.TIMED_OUT, logistics.status());
        assertTrue(logistics.score().hasCondition(RiskCondition.AGENT_TIMEOUT));
        assertEquals(true, result.get("truncated"));
        assertTrue(invocations(result).get(0).succeeded());
    }

    @Test
    @DisplayName("each agent in a tier gets its own timeout from its own start")
    void perAgentTimeoutInParallelTier() {
        properties.setAgentTimeout(Duration.ofMillis(300));
        var registry = new AgentRegistry(List.of(
                agent(AgentRole.POLITICAL, ctx -> sleepThen(250, score(RiskDimension.POLITICAL, 40))),
                agent(AgentRole.LOGISTICS, ctx -> sleepThen(900, score(RiskDimension.LOGISTICS, 50)))));

        long start = System.currentTimeMillis();
        var result = node(registry).apply(state(Long.MAX_VALUE));
        long elapsed = System.currentTimeMillis() - start;

        assertTrue(invocations(result).get(0).succeeded());
        var logistics = invocations(result).get(1);
        assertEquals(InvocationStatus.TIMED_OUT, logistics.status());
        assertTrue(logistics.elapsedMs() < 600, "logistics ran for " + logistics.elapsedMs() + "ms");
        assertTrue(elapsed < 600, "tier took " + elapsed + "ms");
        assertEquals(true, result.get("truncated"));
    }

    @Test
    @DisplayName("a passed pipeline deadline records every agent in the tier as timed out")
    void deadlinePassed() {
        var registry = new AgentRegistry(List.of(
                agent(AgentRole.POLITICAL, ctx -> fail("must not run")),
                agent(AgentRole.LOGISTICS, ctx -> fail("must not run"))));

        var result = node(registry).apply(state(1L));

        assertEquals(1, result.get("tierIndex"));
        assertEquals(true, result.get("truncated"));
        var invocations = invocations(result);
        assertEquals(List.of(AgentRole.POLITICAL, AgentRole.LOGISTICS),
                invocations.stream().map(AgentInvocation::role).toList());
        for (var inv : invocations) {
            assertEquals(InvocationStatus.TIMED_OUT, inv.status());
            assertEquals(0.0, inv.score().confidence());
            assertTrue(inv.score().hasCondition(RiskCondition.AGENT_TIMEOUT));
        }
        assertEquals(2, events.stream().filter(e -> e.eventType().equals("agent.finished")).count());
    }

    private static RiskScore sleepThen(long millis, RiskScore score) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return score;
    }
}
