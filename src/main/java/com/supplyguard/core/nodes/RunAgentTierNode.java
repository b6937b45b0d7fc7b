package com.supplyguard.core.nodes;

import com.supplyguard.core.agents.AgentContext;
import com.supplyguard.core.agents.AgentRegistry;
import com.supplyguard.core.config.PipelineProperties;
import com.supplyguard.core.events.EventBus;
import com.supplyguard.core.events.RiskEvent;
import com.supplyguard.core.logging.MdcContext;
import com.supplyguard.core.metrics.SupplyGuardMetrics;
import com.supplyguard.core.model.AgentInvocation;
import com.supplyguard.core.model.AgentRole;
import com.supplyguard.core.model.InvocationStatus;
import com.supplyguard.core.model.Provenance;
import com.supplyguard.core.model.RiskCondition;
import com.supplyguard.core.model.RiskLevel;
import com.supplyguard.core.model.RiskScore;
import com.supplyguard.core.model.ThreadStatus;
import com.supplyguard.core.state.AnalysisState;
import com.supplyguard.core.storage.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one tier of the pipeline. Agents in the tier run concurrently on the
 * agent executor and all of them finish or time out before the node returns.
 *
 * <p>Each agent gets at most the per-agent timeout counted from its own start,
 * and never runs past the pipeline deadline. When either fires the invocation
 * is recorded as timed out and the thread is marked truncated, which skips any
 * remaining tiers. A tier reached after the deadline records a timed-out
 * invocation per agent. A storage failure in any agent fails the thread. Any
 * other agent exception is recorded as a failed invocation and the pipeline
 * carries on.
 */
@Component
public class RunAgentTierNode {

    private static final Logger log = LoggerFactory.getLogger(RunAgentTierNode.class);

    private final AgentRegistry registry;
    private final ExecutorService executor;
    private final PipelineProperties properties;
    private final EventBus eventBus;
    private final SupplyGuardMetrics metrics;

    public RunAgentTierNode(AgentRegistry registry, @Qualifier("agentExecutor") ExecutorService executor,
                            PipelineProperties properties, EventBus eventBus,
                            SupplyGuardMetrics metrics) {
        this.registry = registry;
        this.executor = executor;
        this.properties = properties;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(AnalysisState state) {
        var plan = state.plan().orElseThrow(() ->
                new IllegalStateException("Thread " + state.threadId() + " has no pipeline plan"));
        int tierIndex = state.tierIndex();
        List<AgentRole> tier = plan.tiers().get(tierIndex);
        String threadId = state.threadId();
        var context = new AgentContext(threadId, state.query(), state.intent().orElseThrow(),
                state.invocations(), state.truncated());

        if (System.currentTimeMillis() >= state.deadlineEpochMs()) {
            log.warn("Thread {} hit the pipeline deadline before tier {}; skipping {}", threadId, tierIndex + 1, tier);
            long now = System.currentTimeMillis();
            var skipped = new ArrayList<AgentInvocation>();
            for (var role : tier) {
                skipped.add(invocation(role, tierIndex, context, InvocationStatus.TIMED_OUT,
                        degraded(role, RiskCondition.AGENT_TIMEOUT, "pipeline deadline passed"),
                        "pipeline deadline passed", now));
            }
            publishFinished(threadId, skipped);
            return Map.of(
                    "invocations", state.invocationsWith(skipped),
                    "tierIndex", plan.tierCount(),
                    "truncated", true,
                    "transitions", state.transitionsWith(ThreadStatus.RUNNING.name() + "[deadline]"));
        }

        log.info("Thread {} running tier {} of {}: {}", threadId, tierIndex + 1, plan.tierCount(), tier);

        var futures = new LinkedHashMap<AgentRole, Future<RiskScore>>();
        var started = new HashMap<AgentRole, Long>();
        for (var role : tier) {
            started.put(role, System.currentTimeMillis());
            futures.put(role, executor.submit(() -> runAgent(role, context)));
        }

        var invocations = new ArrayList<AgentInvocation>();
        boolean truncated = false;
        StorageUnavailableException storageFailure = null;

        for (var entry : futures.entrySet()) {
            var role = entry.getKey();
            var future = entry.getValue();
            long now = System.currentTimeMillis();
            long waitMs = Math.min(started.get(role) + properties.getAgentTimeout().toMillis() - now,
                    state.deadlineEpochMs() - now);
            try {
                RiskScore score = future.get(Math.max(0, waitMs), TimeUnit.MILLISECONDS);
                invocations.add(invocation(role, tierIndex, context, InvocationStatus.SUCCEEDED, score, null,
                        started.get(role)));
            } catch (TimeoutException e) {
                future.cancel(true);
                truncated = true;
                log.warn("Agent {} timed out on thread {}", role.agentName(), threadId);
                invocations.add(invocation(role, tierIndex, context, InvocationStatus.TIMED_OUT,
                        degraded(role, RiskCondition.AGENT_TIMEOUT, "timed out"),
                        "timed out", started.get(role)));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof StorageUnavailableException storage) {
                    storageFailure = storage;
                    invocations.add(invocation(role, tierIndex, context, InvocationStatus.FAILED,
                            degraded(role, RiskCondition.AGENT_FAILURE, cause.getMessage()),
                            cause.getMessage(), started.get(role)));
                } else {
                    log.error("Agent {} failed on thread {}: {}", role.agentName(), threadId, cause.getMessage(), cause);
                    invocations.add(invocation(role, tierIndex, context, InvocationStatus.FAILED,
                            degraded(role, RiskCondition.AGENT_FAILURE, cause.getMessage()),
                            String.valueOf(cause.getMessage()), started.get(role)));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                truncated = true;
                invocations.add(invocation(role, tierIndex, context, InvocationStatus.TIMED_OUT,
                        degraded(role, RiskCondition.AGENT_TIMEOUT, "interrupted"),
                        "interrupted", started.get(role)));
            }
        }

        publishFinished(threadId, invocations);

        var updates = new HashMap<String, Object>();
        updates.put("invocations", state.invocationsWith(invocations));
        updates.put("tierIndex", tierIndex + 1);
        if (storageFailure != null) {
            log.error("Thread {} failed: storage unavailable: {}", threadId, storageFailure.getMessage());
            updates.put("status", ThreadStatus.FAILED.name());
            updates.put("fatalError", storageFailure.getMessage());
            updates.put("transitions", state.transitionsWith(ThreadStatus.FAILED.name()));
            return updates;
        }
        if (truncated || state.truncated()) {
            updates.put("truncated", true);
        }
        updates.put("transitions", state.transitionsWith(ThreadStatus.RUNNING.name() + tier));
        return updates;
    }

    private void publishFinished(String threadId, List<AgentInvocation> invocations) {
        for (var inv : invocations) {
            if (metrics != null) {
                metrics.recordAgentExecution(inv.role().agentName(), inv.status().name(), inv.elapsedMs());
            }
            eventBus.publish(new RiskEvent("agent.finished", threadId, inv.role().agentName(),
                    Map.of("status", inv.status().name(),
                           "elapsedMs", inv.elapsedMs(),
                           "score", inv.score().score()),
                    Instant.now()));
        }
    }

    private RiskScore runAgent(AgentRole role, AgentContext context) {
        MdcContext.setAgent(context.threadId(), role.agentName());
        try {
            eventBus.publish(new RiskEvent("agent.started", context.threadId(), role.agentName(),
                    Map.of("role", role.name()), Instant.now()));
            return registry.agent(role).analyze(context);
        } finally {
            MdcContext.clear();
        }
    }

    private static AgentInvocation invocation(AgentRole role, int tier, AgentContext context,
                                              InvocationStatus status, RiskScore score, String error,
                                              long startedMs) {
        var input = new LinkedHashMap<String, Object>();
        input.put("query", context.query().text());
        input.put("domains", context.intent().domains().stream().map(d -> d.wireName()).toList());
        return new AgentInvocation(role, tier, input, status, score, error,
                System.currentTimeMillis() - startedMs);
    }

    /**
     * Zero-confidence placeholder for an agent that produced nothing.
     */
    static RiskScore degraded(AgentRole role, RiskCondition condition, String reason) {
        return new RiskScore(role.dimension(), 0.0, RiskLevel.LOW,
                role.agentName() + " did not complete: " + reason,
                List.of(), Provenance.TRADITIONAL, 0.0, Set.of(condition), null,
                Map.of("error", String.valueOf(reason)));
    }
}
