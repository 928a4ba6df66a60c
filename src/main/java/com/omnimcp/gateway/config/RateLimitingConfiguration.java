package com.omnimcp.gateway.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Per-client token buckets for API rate limiting.
 * A bucket left untouched for a whole window is full again, so it is dropped
 * and rebuilt on the client's next request.
 */
@Configuration
@Slf4j
public class RateLimitingConfiguration {

    private static final Duration WINDOW = Duration.ofMinutes(1);

    private final GatewayProperties properties;
    private final Cache<String, Bucket> buckets;

    public RateLimitingConfiguration(GatewayProperties properties) {
        this.properties = properties;
        this.buckets = Caffeine.newBuilder()
            .maximumSize(properties.getRateLimit().getMaxClients())
            .expireAfterAccess(WINDOW)
            .build();
    }

    public boolean isEnabled() {
        return properties.getRateLimit().isEnabled();
    }

    public int getPerMinute() {
        return properties.getRateLimit().getPerMinute();
    }

    /**
     * The configured static API key, or null when none is set.
     */
    public String getConfiguredApiKey() {
        return properties.getApiKey();
    }

    public Bucket resolveBucket(String clientKey) {
        return buckets.get(clientKey, key -> {
            log.debug("Creating rate limit bucket for client {}", key);
            return Bucket.builder().addLimit(toBandwidth()).build();
        });
    }

    long trackedClients() {
        buckets.cleanUp();
        return buckets.estimatedSize();
    }

    Bandwidth toBandwidth() {
        int capacity = getPerMinute();
        return Bandwidth.builder()
            .capacity(capacity)
            .refillIntervally(capacity, WINDOW)
            .build();
    }
}
