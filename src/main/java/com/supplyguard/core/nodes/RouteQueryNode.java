package com.supplyguard.core.nodes;

import com.supplyguard.core.classifier.ClassifierFailureException;
import com.supplyguard.core.classifier.IntentClassifier;
import com.supplyguard.core.model.AgentRole;
import com.supplyguard.core.model.ThreadStatus;
import com.supplyguard.core.routing.PipelineTable;
import com.supplyguard.core.state.AnalysisState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Classifies the query and fixes the agent pipeline for the thread. A caller
 * that named an agent or a set of domains gets that pipeline instead of the
 * keyword-routed one; the extracted entities are kept either way.
 * A classifier failure fails the thread; nothing downstream can run without an intent.
 */
@Component
public class RouteQueryNode {

    private static final Logger log = LoggerFactory.getLogger(RouteQueryNode.class);

    private final IntentClassifier classifier;
    private final PipelineTable pipelineTable;

    public RouteQueryNode(IntentClassifier classifier, PipelineTable pipelineTable) {
        this.classifier = classifier;
        this.pipelineTable = pipelineTable;
    }

    public Map<String, Object> apply(AnalysisState state) {
        var query = state.query();
        var updates = new HashMap<String, Object>();
        try {
            var intent = classifier.classify(query.text(), query.context());
            var plan = pipelineTable.planFor(intent.domains());
            var targetRole = state.targetRole();
            var targetDomains = state.targetDomains();
            if (targetRole.isPresent()) {
                var role = targetRole.get();
                plan = pipelineTable.planForAgents(List.of(role), false);
                intent = intent.routedTo(List.of(role.dimension()), plan.sequence());
            } else if (!targetDomains.isEmpty()) {
                var roles = Arrays.stream(AgentRole.values())
                        .filter(r -> targetDomains.contains(r.dimension()))
                        .toList();
                plan = pipelineTable.planForAgents(roles, true);
                intent = intent.routedTo(targetDomains, plan.sequence());
            }
            log.info("Thread {} routed to {} with pipeline {}",
                    state.threadId(), intent.domains(), intent.agentSequence());
            updates.put("intent", intent);
            updates.put("plan", plan);
            updates.put("tierIndex", 0);
            updates.put("status", ThreadStatus.RUNNING.name());
            updates.put("transitions", state.transitionsWith(
                    ThreadStatus.ROUTING.name(), ThreadStatus.RUNNING.name()));
        } catch (ClassifierFailureException e) {
            log.error("Thread {} failed during classification: {}", state.threadId(), e.getMessage(), e);
            updates.put("status", ThreadStatus.FAILED.name());
            updates.put("fatalError", e.getMessage());
            updates.put("transitions", state.transitionsWith(
                    ThreadStatus.ROUTING.name(), ThreadStatus.FAILED.name()));
        }
        return updates;
    }
}
