package com.omnimcp.gateway.model;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mutable runtime view of one backend. Only the server manager changes it.
 */
public class BackendInstance {

    private final BackendDescriptor descriptor;
    private final AtomicInteger activeConnections = new AtomicInteger(0);
    private volatile boolean healthy = false;
    private volatile Instant lastHealthCheck;

    public BackendInstance(BackendDescriptor descriptor, Instant createdAt) {
        this.descriptor = descriptor;
        this.lastHealthCheck = createdAt;
    }

    public String getId() {
        return descriptor.getId();
    }

    public String getBaseUrl() {
        return descriptor.getBaseUrl();
    }

    public BackendDescriptor getDescriptor() {
        return descriptor;
    }

    public Set<String> getCapabilities() {
        return descriptor.getCapabilities();
    }

    public boolean isHealthy() {
        return healthy;
    }

    public Instant getLastHealthCheck() {
        return lastHealthCheck;
    }

    public int getActiveConnections() {
        return activeConnections.get();
    }

    /**
     * Records a probe outcome.
     *
     * @return the previous health flag
     */
    public boolean recordHealthCheck(boolean nowHealthy, Instant checkedAt) {
        boolean previous = this.healthy;
        this.healthy = nowHealthy;
        this.lastHealthCheck = checkedAt;
        return previous;
    }

    public int acquire() {
        return activeConnections.incrementAndGet();
    }

    /**
     * Decrements the connection count, never below zero.
     */
    public int release() {
        return activeConnections.updateAndGet(current -> current > 0 ? current - 1 : 0);
    }

    public List<String> capabilityList() {
        return List.copyOf(descriptor.getCapabilities());
    }
}
