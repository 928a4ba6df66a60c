package com.omnimcp.gateway.health;

import com.omnimcp.gateway.dto.BackendHealthStatus;
import com.omnimcp.gateway.service.ServerManager;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Health indicator for the configured backends, exposed as {@code backends}
 */
@Component("backendsHealthIndicator")
public class BackendHealthIndicator implements HealthIndicator {

    public static final Status DEGRADED = new Status("DEGRADED", "Some backends are unhealthy");

    private final ServerManager serverManager;

    public BackendHealthIndicator(ServerManager serverManager) {
        this.serverManager = serverManager;
    }

    @Override
    public Health health() {
        Map<String, BackendHealthStatus> backends = serverManager.getHealthStatus();
        if (backends.isEmpty()) {
            return Health.unknown().withDetail("reason", "No backends configured").build();
        }

        long healthy = backends.values().stream().filter(status -> status.getHealthy() > 0).count();
        Health.Builder builder;
        if (healthy == backends.size()) {
            builder = Health.up();
        } else if (healthy > 0) {
            builder = Health.status(DEGRADED);
        } else {
            builder = Health.down();
        }

        builder.withDetail("healthy", healthy)
            .withDetail("total", backends.size());
        backends.forEach((id, status) -> builder.withDetail(id, status.getHealthy() > 0 ? "UP" : "DOWN"));
        return builder.build();
    }
}
