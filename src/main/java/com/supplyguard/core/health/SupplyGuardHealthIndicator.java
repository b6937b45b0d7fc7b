package com.supplyguard.core.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator view of {@link HealthCheckService}. DOWN if any component is down;
 * a degraded component is reported in the details only.
 */
@Component("supplyGuardHealthIndicator")
public class SupplyGuardHealthIndicator implements HealthIndicator {

    private final HealthCheckService healthCheckService;

    public SupplyGuardHealthIndicator(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Health health() {
        var checks = healthCheckService.checkAll();
        boolean anyDown = checks.stream().anyMatch(c -> c.status() == HealthStatus.Status.DOWN);
        var builder = anyDown ? Health.down() : Health.up();
        for (var check : checks) {
            builder.withDetail(check.component(), check.status() + ": " + check.detail());
        }
        return builder.build();
    }
}
