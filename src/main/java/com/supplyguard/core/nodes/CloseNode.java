package com.supplyguard.core.nodes;

import com.supplyguard.core.config.PipelineProperties;
import com.supplyguard.core.model.AgentInvocation;
import com.supplyguard.core.model.RiskCondition;
import com.supplyguard.core.model.ThreadStatus;
import com.supplyguard.core.state.AnalysisState;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Seals the thread. Pipelines without a reporting stage take the last
 * invocation's score as the final one.
 */
@Component
public class CloseNode {

    private final PipelineProperties properties;

    public CloseNode(PipelineProperties properties) {
        this.properties = properties;
    }

    public Map<String, Object> apply(AnalysisState state) {
        var updates = new HashMap<String, Object>();
        if (state.finalScore().isEmpty()) {
            var invocations = state.invocations();
            if (!invocations.isEmpty()) {
                AgentInvocation last = invocations.get(invocations.size() - 1);
                var score = last.score();
                if (state.truncated()) {
                    score = score.withConfidence(score.confidence() * properties.getTruncatedConfidenceFactor())
                            .withCondition(RiskCondition.PIPELINE_TRUNCATED);
                }
                updates.put("finalScore", score);
            }
        }
        updates.put("status", ThreadStatus.CLOSED.name());
        updates.put("transitions", state.transitionsWith(ThreadStatus.CLOSED.name()));
        return updates;
    }
}
