package com.omnimcp.gateway.monitoring;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Micrometer instruments for JSON-RPC traffic, backend health and open
 * client connections.
 */
@Component
public class GatewayMetrics {

    private static final String REQUEST_COUNTER = "mcp.gateway.requests";
    private static final String REQUEST_TIMER = "mcp.gateway.request.duration";
    private static final String HEALTH_TRANSITION_COUNTER = "mcp.gateway.backend.health.transitions";
    private static final String FAN_OUT_FAILURE_COUNTER = "mcp.gateway.fanout.failures";
    private static final String RATE_LIMIT_COUNTER = "mcp.gateway.ratelimit.exceeded";

    private final MeterRegistry meterRegistry;

    public GatewayMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void recordRequest(String method, String outcome, long durationMs) {
        Counter.builder(REQUEST_COUNTER)
            .tag("method", method)
            .tag("outcome", outcome)
            .register(meterRegistry)
            .increment();

        Timer.builder(REQUEST_TIMER)
            .tag("method", method)
            .register(meterRegistry)
            .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordHealthTransition(String backendId, boolean healthy) {
        Counter.builder(HEALTH_TRANSITION_COUNTER)
            .tag("backend", backendId)
            .tag("to", healthy ? "healthy" : "unhealthy")
            .register(meterRegistry)
            .increment();
    }

    public void recordFanOutFailure(String backendId, String method) {
        Counter.builder(FAN_OUT_FAILURE_COUNTER)
            .tag("backend", backendId)
            .tag("method", method)
            .register(meterRegistry)
            .increment();
    }

    public void recordRateLimitExceeded() {
        meterRegistry.counter(RATE_LIMIT_COUNTER).increment();
    }

    /**
     * Registers a gauge read from {@code value} on every scrape. The supplier
     * is held strongly.
     */
    public void registerGauge(String name, Supplier<Number> value) {
        Gauge.builder(name, value, s -> s.get().doubleValue())
            .strongReference(true)
            .register(meterRegistry);
    }
}
