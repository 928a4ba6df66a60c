package com.omnimcp.gateway.config;

import io.github.bucket4j.Bucket;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RateLimitingConfigurationTest {

    @Test
    void bucketAllowsPerMinuteRequestsThenRefuses() {
        GatewayProperties properties = new GatewayProperties();
        properties.getRateLimit().setPerMinute(3);
        RateLimitingConfiguration configuration = new RateLimitingConfiguration(properties);

        Bucket bucket = configuration.resolveBucket("ip:127.0.0.1");

        assertThat(bucket.tryConsume(1)).isTrue();
        assertThat(bucket.tryConsume(1)).isTrue();
        assertThat(bucket.tryConsume(1)).isTrue();
        assertThat(bucket.tryConsume(1)).isFalse();
    }

    @Test
    void bucketsAreKeptPerClient() {
        GatewayProperties properties = new GatewayProperties();
        properties.getRateLimit().setPerMinute(1);
        RateLimitingConfiguration configuration = new RateLimitingConfiguration(properties);

        assertThat(configuration.resolveBucket("a")).isSameAs(configuration.resolveBucket("a"));
        assertThat(configuration.resolveBucket("a").tryConsume(1)).isTrue();
        assertThat(configuration.resolveBucket("b").tryConsume(1)).isTrue();
    }

    @Test
    void trackedClientsAreBounded() {
        GatewayProperties properties = new GatewayProperties();
        properties.getRateLimit().setPerMinute(1);
        properties.getRateLimit().setMaxClients(10);
        RateLimitingConfiguration configuration = new RateLimitingConfiguration(properties);

        for (int i = 0; i < 1000; i++) {
            configuration.resolveBucket("ip:10.0." + (i / 256) + "." + (i % 256));
        }

        assertThat(configuration.trackedClients()).isLessThanOrEqualTo(10);
    }

    @Test
    void exposesConfiguredApiKey() {
        GatewayProperties properties = new GatewayProperties();
        properties.setApiKey("mcp_key");

        assertThat(new RateLimitingConfiguration(properties).getConfiguredApiKey()).isEqualTo("mcp_key");
    }
}
