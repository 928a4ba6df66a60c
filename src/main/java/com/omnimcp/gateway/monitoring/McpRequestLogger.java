package com.omnimcp.gateway.monitoring;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Entry/exit logging for JSON-RPC requests. Each request gets its own
 * correlation id, independent of the session, placed in the MDC under
 * {@code requestId} for the duration of each log call.
 */
@Component
@Slf4j
public class McpRequestLogger {

    public static final String MDC_KEY = "requestId";

    private final GatewayMetrics metrics;

    public McpRequestLogger(GatewayMetrics metrics) {
        this.metrics = metrics;
    }

    public String newRequestId() {
        return "req_" + UUID.randomUUID();
    }

    public void mcpRequest(String method, String requestId, String sessionId, Object mcpRequestId) {
        withRequestId(requestId, () ->
            log.info("mcpRequest method={} session={} id={}", method, sessionId, mcpRequestId));
    }

    public void routing(String requestId, String method, String capability, String backendId) {
        withRequestId(requestId, () ->
            log.info("Routing {} (capability {}) to backend {}", method, capability, backendId));
    }

    public void mcpResponse(String method, String requestId, String sessionId, String backendId, long durationMs) {
        withRequestId(requestId, () ->
            log.info("mcpResponse method={} session={} backend={} success=true duration={}ms",
                method, sessionId, backendId, durationMs));
        metrics.recordRequest(method, "success", durationMs);
    }

    public void mcpError(String method, String requestId, String sessionId, int code, Object detail, long durationMs) {
        withRequestId(requestId, () ->
            log.warn("mcpError method={} session={} code={} detail={} duration={}ms",
                method, sessionId, code, detail, durationMs));
        metrics.recordRequest(method, "error", durationMs);
    }

    public void mcpFailure(String method, String requestId, String sessionId, Throwable error, long durationMs) {
        withRequestId(requestId, () ->
            log.error("mcpError method={} session={} duration={}ms", method, sessionId, durationMs, error));
        metrics.recordRequest(method, "failure", durationMs);
    }

    private void withRequestId(String requestId, Runnable logCall) {
        MDC.put(MDC_KEY, requestId);
        try {
            logCall.run();
        } finally {
            MDC.remove(MDC_KEY);
        }
    }
}
