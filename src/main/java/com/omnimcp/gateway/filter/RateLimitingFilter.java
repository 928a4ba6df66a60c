package com.omnimcp.gateway.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.omnimcp.gateway.config.RateLimitingConfiguration;
import com.omnimcp.gateway.monitoring.GatewayMetrics;
import io.github.bucket4j.ConsumptionProbe;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Token-bucket rate limiting per client. Clients presenting the configured
 * API key are limited per key, everyone else per remote address.
 */
@Component
@Order(RateLimitingFilter.ORDER)
@Slf4j
public class RateLimitingFilter implements WebFilter {

    static final int ORDER = Ordered.HIGHEST_PRECEDENCE + 20;
    static final String REMAINING_HEADER = "X-Rate-Limit-Remaining";

    private final RateLimitingConfiguration rateLimiting;
    private final GatewayMetrics metrics;
    private final ObjectMapper objectMapper;

    public RateLimitingFilter(RateLimitingConfiguration rateLimiting, GatewayMetrics metrics,
                              ObjectMapper objectMapper) {
        this.rateLimiting = rateLimiting;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        if (!rateLimiting.isEnabled()) {
            return chain.filter(exchange);
        }

        String clientKey = clientKey(exchange);
        ConsumptionProbe probe = rateLimiting.resolveBucket(clientKey).tryConsumeAndReturnRemaining(1);
        if (probe.isConsumed()) {
            exchange.getResponse().getHeaders().add(REMAINING_HEADER, String.valueOf(probe.getRemainingTokens()));
            return chain.filter(exchange);
        }

        long retryAfter = Math.max(1, TimeUnit.NANOSECONDS.toSeconds(probe.getNanosToWaitForRefill()) + 1);
        log.warn("Rate limit exceeded for {} on {}", FilterResponses.clientIp(exchange),
            exchange.getRequest().getPath());
        metrics.recordRateLimitExceeded();

        exchange.getResponse().getHeaders().add(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "Rate limit exceeded");
        body.put("message", String.format("Too many requests. Limit: %d requests per 1 minute",
            rateLimiting.getPerMinute()));
        body.put("retryAfter", retryAfter);
        return FilterResponses.writeJson(exchange, objectMapper, HttpStatus.TOO_MANY_REQUESTS, body);
    }

    private String clientKey(ServerWebExchange exchange) {
        String apiKey = ApiKeyAuthenticationFilter.extractApiKey(exchange.getRequest());
        // Unverified keys must not open a bucket of their own.
        if (apiKey != null && ApiKeyAuthenticationFilter.isValidApiKey(apiKey, rateLimiting.getConfiguredApiKey())) {
            return "api:" + apiKey;
        }
        return "ip:" + FilterResponses.clientIp(exchange);
    }
}
