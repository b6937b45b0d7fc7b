package com.supplyguard.core.health;

import com.supplyguard.core.graph.AnalysisGraph;
import com.supplyguard.core.llm.AiProperties;
import com.supplyguard.core.llm.RateLimitedExecutor;
import com.supplyguard.core.metrics.SupplyGuardMetrics;
import com.supplyguard.core.storage.StorageUnavailableException;
import com.supplyguard.core.storage.SupplyChainRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Status;

import java.time.Duration;
import java.util.List;

import static com.supplyguard.core.TestFixtures.disabledAi;
import static com.supplyguard.core.TestFixtures.equipment;
import static com.supplyguard.core.TestFixtures.repository;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class HealthCheckServiceTest {

    private final RateLimitedExecutor executor = new RateLimitedExecutor(2, Duration.ofMillis(100),
            new SupplyGuardMetrics(new SimpleMeterRegistry()));

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private static HealthStatus component(List<HealthStatus> results, String name) {
        return results.stream().filter(s -> name.equals(s.component())).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("checkAll returns graph, storage and ai components")
    void checkAllReturnsAllComponents() {
        var service = new HealthCheckService(null, null, new AiProperties(), executor);

        var components = service.checkAll().stream().map(HealthStatus::component).toList();
        assertEquals(List.of("graph", "storage", "ai"), components);
    }

    @Test
    @DisplayName("missing graph and storage are DOWN")
    void missingComponentsDown() {
        var results = new HealthCheckService(null, null, new AiProperties(), executor).checkAll();

        assertEquals(HealthStatus.Status.DOWN, component(results, "graph").status());
        assertEquals(HealthStatus.Status.DOWN, component(results, "storage").status());
        assertEquals(HealthStatus.Status.UP, component(results, "ai").status());
    }

    @Test
    @DisplayName("populated storage is UP with counts")
    void storageUp() {
        var repo = repository(List.of(equipment("EQ-1", "robot", "china", "germany")), List.of(), List.of());
        var results = new HealthCheckService(mock(AnalysisGraph.class), repo, new AiProperties(), executor).checkAll();

        var storage = component(results, "storage");
        assertEquals(HealthStatus.Status.UP, storage.status());
        assertEquals("1", storage.metadata().get("equipment"));
        assertEquals(HealthStatus.Status.UP, component(results, "graph").status());
    }

    @Test
    @DisplayName("empty storage is DEGRADED and failing storage is DOWN")
    void storageDegradedOrDown() {
        var empty = new HealthCheckService(null, repository(List.of(), List.of(), List.of()),
                new AiProperties(), executor).checkAll();
        assertEquals(HealthStatus.Status.DEGRADED, component(empty, "storage").status());

        var broken = mock(SupplyChainRepository.class);
        when(broken.findEquipment(any())).thenThrow(new StorageUnavailableException("disk gone"));
        var failing = new HealthCheckService(null, broken, new AiProperties(), executor).checkAll();
        var storage = component(failing, "storage");
        assertEquals(HealthStatus.Status.DOWN, storage.status());
        assertTrue(storage.detail().contains("disk gone"));
    }

    @Test
    @DisplayName("disabled AI is DEGRADED")
    void aiDisabled() {
        var results = new HealthCheckService(null, null, disabledAi(), executor).checkAll();

        var ai = component(results, "ai");
        assertEquals(HealthStatus.Status.DEGRADED, ai.status());
        assertEquals("2", ai.metadata().get("maxConcurrency"));
    }

    @Test
    @DisplayName("indicator is DOWN when any component is DOWN")
    void indicator() {
        var repo = repository(List.of(equipment("EQ-1", "robot", "china", "germany")), List.of(), List.of());
        var healthy = new SupplyGuardHealthIndicator(
                new HealthCheckService(mock(AnalysisGraph.class), repo, disabledAi(), executor));
        var broken = new SupplyGuardHealthIndicator(
                new HealthCheckService(null, repo, disabledAi(), executor));

        assertEquals(Status.UP, healthy.health().getStatus());
        assertTrue(String.valueOf(healthy.health().getDetails().get("ai")).startsWith("DEGRADED"));
        assertEquals(Status.DOWN, broken.health().getStatus());
    }
}
