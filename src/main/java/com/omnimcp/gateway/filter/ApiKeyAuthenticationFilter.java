package com.omnimcp.gateway.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.omnimcp.gateway.config.GatewayProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Static API key check, active when {@code gateway.require-api-key} is set.
 * The key may come from {@code x-api-key} or an {@code Authorization: Bearer}
 * header; {@code x-api-key} wins so the bearer slot stays free for session
 * tokens.
 */
@Component
@Order(ApiKeyAuthenticationFilter.ORDER)
@Slf4j
public class ApiKeyAuthenticationFilter implements WebFilter {

    static final int ORDER = RateLimitingFilter.ORDER + 1;
    static final String API_KEY_HEADER = "x-api-key";
    private static final String BEARER_PREFIX = "Bearer ";
    private static final String OPEN_PATH = "/health";

    private final GatewayProperties properties;
    private final ObjectMapper objectMapper;

    public ApiKeyAuthenticationFilter(GatewayProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        if (!properties.isRequireApiKey()
            || OPEN_PATH.equals(request.getPath().value())
            || HttpMethod.OPTIONS.equals(request.getMethod())) {
            return chain.filter(exchange);
        }

        String apiKey = extractApiKey(request);
        if (apiKey == null) {
            log.warn("Missing API key from {} for {}", FilterResponses.clientIp(exchange), request.getPath());
            return unauthorized(exchange, "API key required. Provide via Authorization header or x-api-key");
        }
        if (!isValidApiKey(apiKey, properties.getApiKey())) {
            log.warn("Invalid API key {} from {} for {}",
                maskApiKey(apiKey), FilterResponses.clientIp(exchange), request.getPath());
            return unauthorized(exchange, "Invalid API key");
        }

        log.debug("API key validated: {}", maskApiKey(apiKey));
        return chain.filter(exchange);
    }

    static String extractApiKey(ServerHttpRequest request) {
        String header = request.getHeaders().getFirst(API_KEY_HEADER);
        if (header != null && !header.isBlank()) {
            return header;
        }
        String authorization = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            return authorization.substring(BEARER_PREFIX.length());
        }
        return null;
    }

    static boolean isValidApiKey(String provided, String configured) {
        if (configured == null || configured.isEmpty()) {
            return false;
        }
        return MessageDigest.isEqual(
            provided.getBytes(StandardCharsets.UTF_8),
            configured.getBytes(StandardCharsets.UTF_8));
    }

    static String maskApiKey(String apiKey) {
        if (apiKey.length() <= 8) {
            return "*".repeat(apiKey.length());
        }
        return apiKey.substring(0, 8) + "*".repeat(apiKey.length() - 8);
    }

    private Mono<Void> unauthorized(ServerWebExchange exchange, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "Unauthorized");
        body.put("message", message);
        return FilterResponses.writeJson(exchange, objectMapper, HttpStatus.UNAUTHORIZED, body);
    }
}
