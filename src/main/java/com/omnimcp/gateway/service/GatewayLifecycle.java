package com.omnimcp.gateway.service;

import com.omnimcp.gateway.sse.SseConnectionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Runs the initial backend health round before the web server accepts
 * traffic, and tears sessions, health timers and SSE streams down after it
 * has stopped.
 */
@Component
@Slf4j
public class GatewayLifecycle implements SmartLifecycle {

    private static final Duration STARTUP_TIMEOUT = Duration.ofMinutes(2);

    private final McpGateway gateway;
    private final SseConnectionRegistry sseConnections;
    private volatile boolean running;

    public GatewayLifecycle(McpGateway gateway, SseConnectionRegistry sseConnections) {
        this.gateway = gateway;
        this.sseConnections = sseConnections;
    }

    @Override
    public void start() {
        gateway.initialize().block(STARTUP_TIMEOUT);
        running = true;
    }

    @Override
    public void stop() {
        log.info("Received shutdown signal, shutting down gracefully...");
        sseConnections.closeAll();
        gateway.shutdown();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Lower than the web server's phase, so this starts first and stops last.
     */
    @Override
    public int getPhase() {
        return 0;
    }
}
