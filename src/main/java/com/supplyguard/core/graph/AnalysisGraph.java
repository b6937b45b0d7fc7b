package com.supplyguard.core.graph;

import com.supplyguard.core.model.ThreadStatus;
import com.supplyguard.core.nodes.CloseNode;
import com.supplyguard.core.nodes.ReportNode;
import com.supplyguard.core.nodes.RouteQueryNode;
import com.supplyguard.core.nodes.RunAgentTierNode;
import com.supplyguard.core.state.AnalysisState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.StateGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds and holds the compiled LangGraph4j {@link StateGraph} that drives one
 * conversation thread.
 * <pre>
 *   START -> route_query -> [routeAfterRouting]
 *            -> END  (classifier failure)
 *            -> run_tier -> [routeAfterTier]
 *               -> run_tier (loop while tiers remain and the pipeline is not truncated)
 *               -> report -> close -> END
 *               -> close -> END  (pipelines without a reporting stage)
 *               -> END  (storage failure)
 * </pre>
 */
@Component
public class AnalysisGraph {

    private static final Logger log = LoggerFactory.getLogger(AnalysisGraph.class);

    private final CompiledGraph<AnalysisState> compiledGraph;

    public AnalysisGraph(RouteQueryNode routeQueryNode,
                         RunAgentTierNode runAgentTierNode,
                         ReportNode reportNode,
                         CloseNode closeNode) throws Exception {

        var graph = new StateGraph<>(AnalysisState.SCHEMA, AnalysisState::new)
                .addNode("route_query", node_async(routeQueryNode::apply))
                .addNode("run_tier", node_async(runAgentTierNode::apply))
                .addNode("report", node_async(reportNode::apply))
                .addNode("close", node_async(closeNode::apply))
                .addEdge(START, "route_query")
                .addConditionalEdges("route_query",
                        edge_async(this::routeAfterRouting),
                        Map.of("run_tier", "run_tier",
                                "report", "report",
                                "close", "close",
                                "failed", END))
                .addConditionalEdges("run_tier",
                        edge_async(this::routeAfterTier),
                        Map.of("run_tier", "run_tier",
                                "report", "report",
                                "close", "close",
                                "failed", END))
                .addEdge("report", "close")
                .addEdge("close", END);

        this.compiledGraph = graph.compile();
        log.info("Analysis graph compiled");
    }

    String routeAfterRouting(AnalysisState state) {
        if (state.status() == ThreadStatus.FAILED) {
            return "failed";
        }
        return state.hasMoreTiers() ? "run_tier" : afterLastTier(state);
    }

    /**
     * Loops over the tiers; a truncated pipeline goes straight to reporting.
     */
    String routeAfterTier(AnalysisState state) {
        if (state.status() == ThreadStatus.FAILED) {
            return "failed";
        }
        if (!state.truncated() && state.hasMoreTiers()) {
            return "run_tier";
        }
        return afterLastTier(state);
    }

    private static String afterLastTier(AnalysisState state) {
        boolean reporting = state.plan().map(p -> p.reporting()).orElse(false);
        return reporting ? "report" : "close";
    }

    public CompiledGraph<AnalysisState> getCompiledGraph() {
        return compiledGraph;
    }
}
