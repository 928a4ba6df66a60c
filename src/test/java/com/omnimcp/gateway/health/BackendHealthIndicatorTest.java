package com.omnimcp.gateway.health;

import com.omnimcp.gateway.dto.BackendHealthStatus;
import com.omnimcp.gateway.service.ServerManager;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BackendHealthIndicatorTest {

    @Mock
    private ServerManager serverManager;

    @InjectMocks
    private BackendHealthIndicator indicator;

    private static BackendHealthStatus status(int healthy) {
        return BackendHealthStatus.builder()
            .instances(1)
            .healthy(healthy)
            .capabilities(List.of())
            .lastCheck("2024-01-01T00:00:00Z")
            .build();
    }

    private static Map<String, BackendHealthStatus> backends(int linear, int perplexity) {
        Map<String, BackendHealthStatus> map = new LinkedHashMap<>();
        map.put("linear", status(linear));
        map.put("perplexity", status(perplexity));
        return map;
    }

    @Test
    void upWhenEveryBackendIsHealthy() {
        when(serverManager.getHealthStatus()).thenReturn(backends(1, 1));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("healthy", 2L).containsEntry("linear", "UP");
    }

    @Test
    void degradedWhenSomeBackendsAreDown() {
        when(serverManager.getHealthStatus()).thenReturn(backends(1, 0));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(BackendHealthIndicator.DEGRADED);
        assertThat(health.getDetails()).containsEntry("perplexity", "DOWN");
    }

    @Test
    void downWhenNoBackendIsHealthy() {
        when(serverManager.getHealthStatus()).thenReturn(backends(0, 0));

        assertThat(indicator.health().getStatus()).isEqualTo(Status.DOWN);
    }

    @Test
    void unknownWithoutBackends() {
        when(serverManager.getHealthStatus()).thenReturn(Map.of());

        assertThat(indicator.health().getStatus()).isEqualTo(Status.UNKNOWN);
    }
}
