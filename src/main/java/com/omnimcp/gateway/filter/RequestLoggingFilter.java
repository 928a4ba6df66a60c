package com.omnimcp.gateway.filter;

import com.omnimcp.gateway.monitoring.McpRequestLogger;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Tags every HTTP exchange with an {@code X-Request-ID} and logs its
 * completion with status and elapsed time.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@Slf4j
public class RequestLoggingFilter implements WebFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        String incoming = request.getHeaders().getFirst(REQUEST_ID_HEADER);
        String requestId = incoming != null && !incoming.isBlank() ? incoming : UUID.randomUUID().toString();
        exchange.getResponse().getHeaders().set(REQUEST_ID_HEADER, requestId);

        long startTime = System.currentTimeMillis();
        log.debug("[{}] --> {} {} from {}", requestId, request.getMethod(), request.getPath(),
            FilterResponses.clientIp(exchange));

        return chain.filter(exchange)
            .doFinally(signalType -> logCompletion(exchange, requestId, startTime));
    }

    private void logCompletion(ServerWebExchange exchange, String requestId, long startTime) {
        long duration = System.currentTimeMillis() - startTime;
        HttpStatusCode status = exchange.getResponse().getStatusCode();
        MDC.put(McpRequestLogger.MDC_KEY, requestId);
        try {
            log.info("Request completed: {} {} ({}) in {}ms",
                exchange.getRequest().getMethod(),
                exchange.getRequest().getPath(),
                status != null ? status.value() : "-",
                duration);
        } finally {
            MDC.remove(McpRequestLogger.MDC_KEY);
        }
    }
}
