package com.omnimcp.gateway.sse;

import com.omnimcp.gateway.monitoring.GatewayMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks open SSE streams so they can be counted and ended on shutdown.
 * SSE streams are not sessions and do not count against session capacity.
 */
@Component
@Slf4j
public class SseConnectionRegistry {

    private final Map<String, Sinks.Empty<Void>> connections = new ConcurrentHashMap<>();

    public SseConnectionRegistry(GatewayMetrics metrics) {
        metrics.registerGauge("mcp.gateway.sse.connections", connections::size);
    }

    public String open() {
        String id = UUID.randomUUID().toString();
        connections.put(id, Sinks.empty());
        log.info("SSE connection established: {}", id);
        return id;
    }

    /**
     * Completes when the stream should end, either because it was closed
     * here or the registry shut down. Already complete for unknown ids.
     */
    public Mono<Void> closeSignal(String id) {
        Sinks.Empty<Void> signal = connections.get(id);
        return signal != null ? signal.asMono() : Mono.empty();
    }

    public void close(String id) {
        Sinks.Empty<Void> signal = connections.remove(id);
        if (signal != null) {
            signal.tryEmitEmpty();
            log.info("SSE connection closed: {}", id);
        }
    }

    public void closeAll() {
        connections.keySet().forEach(this::close);
    }

    public int size() {
        return connections.size();
    }
}
