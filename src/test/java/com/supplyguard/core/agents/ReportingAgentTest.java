package com.supplyguard.core.agents;

import com.supplyguard.core.aggregate.RiskAggregator;
import com.supplyguard.core.config.PipelineProperties;
import com.supplyguard.core.config.RiskProperties;
import com.supplyguard.core.model.AgentInvocation;
import com.supplyguard.core.model.AgentRole;
import com.supplyguard.core.model.Agreement;
import com.supplyguard.core.model.InvocationStatus;
import com.supplyguard.core.model.RiskCondition;
import com.supplyguard.core.model.RiskDimension;
import com.supplyguard.core.model.RiskLevel;
import com.supplyguard.core.model.RiskScore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.supplyguard.core.TestFixtures.context;
import static org.junit.jupiter.api.Assertions.*;

class ReportingAgentTest {

    private PipelineProperties properties;
    private ReportingAgent agent;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        agent = new ReportingAgent(new RiskAggregator(new RiskProperties()), properties);
    }

    private static AgentInvocation succeeded(AgentRole role, double score, RiskLevel level, String... recommendations) {
        var s = RiskScore.of(role.dimension(), score, level, role.name() + " summary")
                .withRecommendations(List.of(recommendations));
        return new AgentInvocation(role, role.tier(), Map.of(), InvocationStatus.SUCCEEDED, s, null, 5);
    }

    private static AgentInvocation failed(AgentRole role) {
        return new AgentInvocation(role, role.tier(), Map.of(), InvocationStatus.FAILED,
                RiskScore.insufficientData(role.dimension(), "boom"), "boom", 5);
    }

    private static AgentContext withPrior(List<AgentInvocation> prior, boolean truncated) {
        var base = context("overall report", RiskDimension.SCHEDULING, List.of());
        return new AgentContext(base.threadId(), base.query(), base.intent(), prior, truncated);
    }

    // ── Aggregation ─────────────────────────────────────────────────

    @Test
    @DisplayName("dimension scores are averaged into an overall verdict")
    void aggregatesDimensions() {
        var score = agent.analyze(withPrior(List.of(
                succeeded(AgentRole.SCHEDULER, 80, RiskLevel.CRITICAL),
                succeeded(AgentRole.POLITICAL, 20, RiskLevel.LOW)), false));

        assertEquals(RiskDimension.OVERALL, score.dimension());
        assertEquals(50.0, score.score(), 0.001);
        assertEquals(RiskLevel.MEDIUM, score.level());
        assertEquals(Agreement.DISAGREEMENT, score.agreement());
        assertEquals(0.8, score.confidence(), 1e-9);
        assertEquals(2, score.details().get("agents_succeeded"));
    }

    @Test
    @DisplayName("a failed agent lowers confidence and is reported")
    void failedAgentLowersConfidence() {
        var score = agent.analyze(withPrior(List.of(
                succeeded(AgentRole.SCHEDULER, 80, RiskLevel.CRITICAL),
                succeeded(AgentRole.POLITICAL, 20, RiskLevel.LOW),
                failed(AgentRole.LOGISTICS)), false));

        assertEquals(50.0, score.score(), 0.001);
        assertEquals(0.8 * 2 / 3, score.confidence(), 1e-9);
        assertTrue(score.hasCondition(RiskCondition.AGENT_FAILURE));
        assertEquals(List.of("LOGISTICS_AGENT: failed"), score.details().get("failed_agents"));
        assertEquals(3, score.details().get("agents_total"));
    }

    @Test
    @DisplayName("a truncated pipeline halves confidence")
    void truncatedPipeline() {
        var score = agent.analyze(withPrior(List.of(
                succeeded(AgentRole.SCHEDULER, 40, RiskLevel.MEDIUM)), true));

        assertEquals(0.4, score.confidence(), 1e-9);
        assertTrue(score.hasCondition(RiskCondition.PIPELINE_TRUNCATED));
    }

    @Test
    @DisplayName("no prior results is insufficient data")
    void nothingToAggregate() {
        var score = agent.analyze(withPrior(List.of(), false));

        assertTrue(score.hasCondition(RiskCondition.INSUFFICIENT_DATA));
        assertEquals(0.0, score.confidence());
    }

    // ── Recommendations ─────────────────────────────────────────────

    @Nested
    @DisplayName("rankRecommendations")
    class Ranking {

        @Test
        @DisplayName("takes the top two of each dimension before the rest")
        void topTwoFirst() {
            properties.setMaxRecommendations(4);
            var ranked = agent.rankRecommendations(List.of(
                    succeeded(AgentRole.SCHEDULER, 50, RiskLevel.MEDIUM, "a1", "a2", "a3"),
                    succeeded(AgentRole.POLITICAL, 50, RiskLevel.MEDIUM, "b1", "b2", "b3")));

            assertEquals(List.of("a1", "a2", "b1", "b2"), ranked);
        }

        @Test
        @DisplayName("drops duplicates across dimensions")
        void deduplicates() {
            var ranked = agent.rankRecommendations(List.of(
                    succeeded(AgentRole.SCHEDULER, 50, RiskLevel.MEDIUM, "same", "a2"),
                    succeeded(AgentRole.POLITICAL, 50, RiskLevel.MEDIUM, "same", "b2", "b3")));

            assertEquals(List.of("same", "a2", "b2", "b3"), ranked);
        }
    }
}
