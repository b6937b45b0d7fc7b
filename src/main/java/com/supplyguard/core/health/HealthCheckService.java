package com.supplyguard.core.health;

import com.supplyguard.core.graph.AnalysisGraph;
import com.supplyguard.core.llm.AiProperties;
import com.supplyguard.core.llm.RateLimitedExecutor;
import com.supplyguard.core.storage.DataFilter;
import com.supplyguard.core.storage.SupplyChainRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final AnalysisGraph analysisGraph;
    private final SupplyChainRepository repository;
    private final AiProperties aiProperties;
    private final RateLimitedExecutor aiExecutor;

    public HealthCheckService(
            @Autowired(required = false) AnalysisGraph analysisGraph,
            @Autowired(required = false) SupplyChainRepository repository,
            AiProperties aiProperties,
            RateLimitedExecutor aiExecutor) {
        this.analysisGraph = analysisGraph;
        this.repository = repository;
        this.aiProperties = aiProperties;
        this.aiExecutor = aiExecutor;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkGraph());
        results.add(checkStorage());
        results.add(checkAi());
        return results;
    }

    private HealthStatus checkGraph() {
        if (analysisGraph != null) {
            return new HealthStatus("graph", HealthStatus.Status.UP,
                    "Graph compiled and available", Map.of());
        }
        return new HealthStatus("graph", HealthStatus.Status.DOWN,
                "Graph not available", Map.of());
    }

    private HealthStatus checkStorage() {
        if (repository == null) {
            return new HealthStatus("storage", HealthStatus.Status.DOWN,
                    "No SupplyChainRepository configured", Map.of());
        }
        try {
            int equipment = repository.findEquipment(DataFilter.all()).size();
            int schedules = repository.findSchedules(DataFilter.all()).size();
            var metadata = Map.of("equipment", String.valueOf(equipment),
                    "schedules", String.valueOf(schedules));
            if (equipment == 0 && schedules == 0) {
                return new HealthStatus("storage", HealthStatus.Status.DEGRADED,
                        "Repository reachable but empty", metadata);
            }
            return new HealthStatus("storage", HealthStatus.Status.UP,
                    "Repository reachable", metadata);
        } catch (Exception e) {
            log.warn("Storage health check failed: {}", e.getMessage());
            return new HealthStatus("storage", HealthStatus.Status.DOWN,
                    "Storage error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkAi() {
        var metadata = Map.of(
                "model", aiProperties.getModel(),
                "inFlight", String.valueOf(aiExecutor.inFlight()),
                "maxConcurrency", String.valueOf(aiExecutor.maxConcurrency()));
        if (!aiProperties.isEnabled()) {
            return new HealthStatus("ai", HealthStatus.Status.DEGRADED,
                    "AI analysis disabled; traditional strategies only", metadata);
        }
        return new HealthStatus("ai", HealthStatus.Status.UP, "AI analysis enabled", metadata);
    }
}
