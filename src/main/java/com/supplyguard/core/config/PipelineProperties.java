package com.supplyguard.core.config;

import com.supplyguard.core.model.AgentRole;
import com.supplyguard.core.model.RiskDimension;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Orchestration limits and the domain to agent-role routing table.
 */
@Component
@ConfigurationProperties(prefix = "supplyguard.pipeline")
public class PipelineProperties {

    private Duration agentTimeout = Duration.ofSeconds(30);
    private Duration pipelineTimeout = Duration.ofSeconds(60);
    private int agentThreads = 8;
    private int maxRecommendations = 8;
    private double truncatedConfidenceFactor = 0.5;
    private Map<RiskDimension, List<AgentRole>> routes = defaultRoutes();

    private static Map<RiskDimension, List<AgentRole>> defaultRoutes() {
        var map = new EnumMap<RiskDimension, List<AgentRole>>(RiskDimension.class);
        map.put(RiskDimension.GENERAL, new ArrayList<>(List.of(AgentRole.ASSISTANT)));
        map.put(RiskDimension.SCHEDULING, new ArrayList<>(List.of(AgentRole.SCHEDULER, AgentRole.REPORTING)));
        map.put(RiskDimension.POLITICAL,
                new ArrayList<>(List.of(AgentRole.SCHEDULER, AgentRole.POLITICAL, AgentRole.REPORTING)));
        map.put(RiskDimension.LOGISTICS,
                new ArrayList<>(List.of(AgentRole.SCHEDULER, AgentRole.LOGISTICS, AgentRole.REPORTING)));
        map.put(RiskDimension.TARIFF,
                new ArrayList<>(List.of(AgentRole.SCHEDULER, AgentRole.TARIFF, AgentRole.REPORTING)));
        return map;
    }

    public Duration getAgentTimeout() { return agentTimeout; }
    public void setAgentTimeout(Duration agentTimeout) { this.agentTimeout = agentTimeout; }
    public Duration getPipelineTimeout() { return pipelineTimeout; }
    public void setPipelineTimeout(Duration pipelineTimeout) { this.pipelineTimeout = pipelineTimeout; }
    public int getAgentThreads() { return agentThreads; }
    public void setAgentThreads(int agentThreads) { this.agentThreads = agentThreads; }
    public int getMaxRecommendations() { return maxRecommendations; }
    public void setMaxRecommendations(int maxRecommendations) { this.maxRecommendations = maxRecommendations; }
    public double getTruncatedConfidenceFactor() { return truncatedConfidenceFactor; }
    public void setTruncatedConfidenceFactor(double truncatedConfidenceFactor) { this.truncatedConfidenceFactor = truncatedConfidenceFactor; }
    public Map<RiskDimension, List<AgentRole>> getRoutes() { return routes; }
    public void setRoutes(Map<RiskDimension, List<AgentRole>> routes) { this.routes = routes; }
}
