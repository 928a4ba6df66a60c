package com.omnimcp.gateway.service;

import com.omnimcp.gateway.config.BackendRegistry;
import com.omnimcp.gateway.config.GatewayProperties;
import com.omnimcp.gateway.dto.BackendHealthStatus;
import com.omnimcp.gateway.model.BackendDescriptor;
import com.omnimcp.gateway.model.BackendInstance;
import com.omnimcp.gateway.monitoring.GatewayMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the runtime health state of every configured backend and arbitrates
 * checkout/release of backend instances. A backend is handed out only while
 * its most recent probe succeeded.
 */
@Service
@Slf4j
public class ServerManager {

    private final BackendClient backendClient;
    private final GatewayMetrics metrics;
    private final Clock clock;
    private final Duration healthCheckTimeout;

    private final Map<String, BackendInstance> instances;
    private final Map<String, Disposable> healthChecks = new ConcurrentHashMap<>();

    public ServerManager(BackendRegistry registry,
                         BackendClient backendClient,
                         GatewayProperties properties,
                         GatewayMetrics metrics,
                         Clock clock) {
        this.backendClient = backendClient;
        this.metrics = metrics;
        this.clock = clock;
        this.healthCheckTimeout = properties.getHealthCheckTimeout();

        Map<String, BackendInstance> byId = new LinkedHashMap<>();
        for (BackendDescriptor descriptor : registry.getBackends()) {
            byId.put(descriptor.getId(), new BackendInstance(descriptor, clock.instant()));
        }
        this.instances = Collections.unmodifiableMap(byId);
    }

    /**
     * Probes every backend once, in configuration order, and starts each
     * backend's periodic timer right after its first probe.
     */
    public Mono<Void> initialize() {
        log.info("Initializing server manager with {} backends", instances.size());
        return Flux.fromIterable(instances.keySet())
            .concatMap(backendId -> performHealthCheck(backendId)
                .doOnSuccess(healthy -> startHealthChecks(backendId)))
            .then();
    }

    public void shutdown() {
        log.info("Shutting down server manager...");
        healthChecks.values().forEach(Disposable::dispose);
        healthChecks.clear();
    }

    /**
     * Single probe of {@code GET {baseUrl}/health}. Emits the new health flag.
     * The last-check timestamp moves on every probe; a log line is written
     * only when the flag flips.
     */
    public Mono<Boolean> performHealthCheck(String backendId) {
        BackendInstance instance = instances.get(backendId);
        if (instance == null) {
            return Mono.empty();
        }

        return backendClient.probeHealth(instance.getDescriptor(), healthCheckTimeout)
            .defaultIfEmpty(false)
            .map(healthy -> {
                boolean wasHealthy = instance.recordHealthCheck(healthy, clock.instant());
                if (healthy != wasHealthy) {
                    if (healthy) {
                        log.info("Server '{}' is now healthy", backendId);
                    } else {
                        log.warn("Server '{}' is now unhealthy", backendId);
                    }
                    metrics.recordHealthTransition(backendId, healthy);
                }
                return healthy;
            });
    }

    /**
     * Checks out a backend, or returns null when it is unknown or unhealthy.
     */
    public BackendInstance getServerInstance(String backendId) {
        BackendInstance instance = instances.get(backendId);
        if (instance == null || !instance.isHealthy()) {
            log.warn("No healthy instances available for server: {}", backendId);
            return null;
        }
        instance.acquire();
        return instance;
    }

    public void releaseServerInstance(BackendInstance instance) {
        if (instance != null) {
            instance.release();
        }
    }

    public Map<String, BackendHealthStatus> getHealthStatus() {
        Map<String, BackendHealthStatus> status = new LinkedHashMap<>();
        instances.forEach((backendId, instance) -> status.put(backendId, BackendHealthStatus.builder()
            .instances(1)
            .healthy(instance.isHealthy() ? 1 : 0)
            .capabilities(instance.capabilityList())
            .lastCheck(instance.getLastHealthCheck().toString())
            .build()));
        return status;
    }

    public Collection<BackendInstance> getInstances() {
        return instances.values();
    }

    boolean isPolling(String backendId) {
        Disposable timer = healthChecks.get(backendId);
        return timer != null && !timer.isDisposed();
    }

    private void startHealthChecks(String backendId) {
        BackendInstance instance = instances.get(backendId);
        Duration interval = instance.getDescriptor().getHealthCheckInterval();

        Disposable timer = Flux.interval(interval, interval)
            .onBackpressureDrop()
            .concatMap(tick -> performHealthCheck(backendId))
            .subscribe(
                healthy -> { },
                error -> log.error("Health check timer for {} stopped", backendId, error));

        Disposable previous = healthChecks.put(backendId, timer);
        if (previous != null) {
            previous.dispose();
        }
        log.debug("Started health checks for {} every {}", backendId, interval);
    }
}
