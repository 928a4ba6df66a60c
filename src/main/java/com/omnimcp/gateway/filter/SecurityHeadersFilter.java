package com.omnimcp.gateway.filter;

import com.omnimcp.gateway.config.GatewayProperties;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Adds hardening headers to every response when
 * {@code gateway.security-headers} is enabled.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class SecurityHeadersFilter implements WebFilter {

    static final String CONTENT_SECURITY_POLICY = "default-src 'self'; "
        + "style-src 'self' 'unsafe-inline'; "
        + "script-src 'self'; "
        + "img-src 'self' data: https:; "
        + "connect-src 'self' ws: wss:; "
        + "font-src 'self'; "
        + "object-src 'none'; "
        + "media-src 'self'; "
        + "frame-src 'none'";

    private final GatewayProperties properties;

    public SecurityHeadersFilter(GatewayProperties properties) {
        this.properties = properties;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        if (properties.isSecurityHeaders()) {
            HttpHeaders headers = exchange.getResponse().getHeaders();
            headers.set("X-Content-Type-Options", "nosniff");
            headers.set("X-Frame-Options", "DENY");
            headers.set("Referrer-Policy", "strict-origin-when-cross-origin");
            headers.set("Content-Security-Policy", CONTENT_SECURITY_POLICY);
        }
        return chain.filter(exchange);
    }
}
