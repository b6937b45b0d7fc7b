package com.supplyguard.core.graph;

import com.supplyguard.core.model.AgentRole;
import com.supplyguard.core.model.ThreadStatus;
import com.supplyguard.core.nodes.CloseNode;
import com.supplyguard.core.nodes.ReportNode;
import com.supplyguard.core.nodes.RouteQueryNode;
import com.supplyguard.core.nodes.RunAgentTierNode;
import com.supplyguard.core.routing.PipelinePlan;
import com.supplyguard.core.state.AnalysisState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

/**
 * Routing decisions of the analysis graph. Full runs through the compiled
 * graph are covered by the engine tests.
 */
class AnalysisGraphTest {

    private static final PipelinePlan TWO_TIERS_WITH_REPORT = new PipelinePlan(
            List.of(List.of(AgentRole.SCHEDULER), List.of(AgentRole.POLITICAL, AgentRole.TARIFF)), true);
    private static final PipelinePlan ASSISTANT_ONLY = new PipelinePlan(List.of(List.of(AgentRole.ASSISTANT)), false);

    private AnalysisGraph graph;

    @BeforeEach
    void setUp() throws Exception {
        graph = new AnalysisGraph(mock(RouteQueryNode.class), mock(RunAgentTierNode.class),
                mock(ReportNode.class), mock(CloseNode.class));
    }

    private static AnalysisState state(ThreadStatus status, PipelinePlan plan, int tierIndex, boolean truncated) {
        var init = new HashMap<String, Object>();
        init.put("status", status.name());
        if (plan != null) {
            init.put("plan", plan);
        }
        init.put("tierIndex", tierIndex);
        init.put("truncated", truncated);
        return new AnalysisState(init);
    }

    @Test
    @DisplayName("graph compiles")
    void compiles() {
        assertNotNull(graph.getCompiledGraph());
    }

    // ── After routing ───────────────────────────────────────────────

    @Nested
    @DisplayName("routeAfterRouting")
    class AfterRouting {

        @Test
        @DisplayName("a failed classification ends the thread")
        void failed() {
            assertEquals("failed", graph.routeAfterRouting(state(ThreadStatus.FAILED, null, 0, false)));
        }

        @Test
        @DisplayName("a plan with tiers runs the first tier")
        void runsTier() {
            assertEquals("run_tier",
                    graph.routeAfterRouting(state(ThreadStatus.RUNNING, TWO_TIERS_WITH_REPORT, 0, false)));
        }

        @Test
        @DisplayName("an empty reporting plan goes straight to the report")
        void emptyPlan() {
            var plan = new PipelinePlan(List.of(), true);
            assertEquals("report", graph.routeAfterRouting(state(ThreadStatus.RUNNING, plan, 0, false)));
        }
    }

    // ── After a tier ────────────────────────────────────────────────

    @Nested
    @DisplayName("routeAfterTier")
    class AfterTier {

        @Test
        @DisplayName("loops while tiers remain")
        void loops() {
            assertEquals("run_tier",
                    graph.routeAfterTier(state(ThreadStatus.RUNNING, TWO_TIERS_WITH_REPORT, 1, false)));
        }

        @Test
        @DisplayName("reports after the last tier")
        void reports() {
            assertEquals("report",
                    graph.routeAfterTier(state(ThreadStatus.RUNNING, TWO_TIERS_WITH_REPORT, 2, false)));
        }

        @Test
        @DisplayName("truncation skips remaining tiers but still reports")
        void truncated() {
            assertEquals("report",
                    graph.routeAfterTier(state(ThreadStatus.RUNNING, TWO_TIERS_WITH_REPORT, 1, true)));
        }

        @Test
        @DisplayName("pipelines without reporting close directly")
        void closes() {
            assertEquals("close", graph.routeAfterTier(state(ThreadStatus.RUNNING, ASSISTANT_ONLY, 1, false)));
        }

        @Test
        @DisplayName("a storage failure ends the thread")
        void failed() {
            assertEquals("failed",
                    graph.routeAfterTier(state(ThreadStatus.FAILED, TWO_TIERS_WITH_REPORT, 1, false)));
        }
    }
}
