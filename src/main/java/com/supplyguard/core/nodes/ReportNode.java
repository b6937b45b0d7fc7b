package com.supplyguard.core.nodes;

import com.supplyguard.core.agents.AgentContext;
import com.supplyguard.core.agents.AgentRegistry;
import com.supplyguard.core.events.EventBus;
import com.supplyguard.core.events.RiskEvent;
import com.supplyguard.core.logging.MdcContext;
import com.supplyguard.core.metrics.SupplyGuardMetrics;
import com.supplyguard.core.model.AgentInvocation;
import com.supplyguard.core.model.AgentRole;
import com.supplyguard.core.model.InvocationStatus;
import com.supplyguard.core.model.ThreadStatus;
import com.supplyguard.core.state.AnalysisState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Runs the reporting agent over whatever the earlier tiers produced.
 * Runs inline and is not subject to the agent timeouts, so a truncated
 * pipeline still gets its report.
 */
@Component
public class ReportNode {

    private static final Logger log = LoggerFactory.getLogger(ReportNode.class);

    private final AgentRegistry registry;
    private final EventBus eventBus;
    private final SupplyGuardMetrics metrics;

    public ReportNode(AgentRegistry registry, EventBus eventBus, SupplyGuardMetrics metrics) {
        this.registry = registry;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(AnalysisState state) {
        String threadId = state.threadId();
        var role = AgentRole.REPORTING;
        var context = new AgentContext(threadId, state.query(), state.intent().orElseThrow(),
                state.invocations(), state.truncated());

        MdcContext.setAgent(threadId, role.agentName());
        long start = System.currentTimeMillis();
        try {
            eventBus.publish(new RiskEvent("agent.started", threadId, role.agentName(),
                    Map.of("role", role.name()), Instant.now()));
            var score = registry.agent(role).analyze(context);
            long elapsed = System.currentTimeMillis() - start;
            var invocation = new AgentInvocation(role, state.plan().map(p -> p.tierCount()).orElse(0),
                    Map.of("query", state.query().text(), "inputs", state.invocations().size()),
                    InvocationStatus.SUCCEEDED, score, null, elapsed);
            if (metrics != null) {
                metrics.recordAgentExecution(role.agentName(), InvocationStatus.SUCCEEDED.name(), elapsed);
            }
            eventBus.publish(new RiskEvent("agent.finished", threadId, role.agentName(),
                    Map.of("status", InvocationStatus.SUCCEEDED.name(),
                           "elapsedMs", elapsed,
                           "score", score.score()),
                    Instant.now()));
            log.info("Thread {} report: {} ({})", threadId, score.level().wireName(), score.score());
            return Map.of(
                    "invocations", state.invocationsWith(List.of(invocation)),
                    "finalScore", score,
                    "status", ThreadStatus.REPORTING.name(),
                    "transitions", state.transitionsWith(ThreadStatus.REPORTING.name()));
        } finally {
            MdcContext.clearAgent();
        }
    }
}
