package com.omnimcp.gateway.config;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.time.Duration;

/**
 * Common tags for every gateway meter, and latency buckets for proxied requests.
 */
@Configuration
public class MetricsConfig {

    static final String REQUEST_TIMER_PREFIX = "mcp.gateway.request.duration";

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags(Environment environment) {
        String profiles = environment.getActiveProfiles().length == 0
            ? "default"
            : String.join(",", environment.getActiveProfiles());
        return registry -> registry.config()
            .commonTags(
                "application", environment.getProperty("spring.application.name", "omni-mcp-gateway"),
                "environment", profiles)
            .meterFilter(requestLatencyBuckets());
    }

    /**
     * Publishes p50/p95/p99 for request durations, bounded by the slowest
     * proxy call a client could wait for.
     */
    static MeterFilter requestLatencyBuckets() {
        return new MeterFilter() {
            @Override
            public DistributionStatisticConfig configure(Meter.Id id, DistributionStatisticConfig config) {
                if (!id.getName().startsWith(REQUEST_TIMER_PREFIX)) {
                    return config;
                }
                return DistributionStatisticConfig.builder()
                    .percentiles(0.5, 0.95, 0.99)
                    .minimumExpectedValue((double) Duration.ofMillis(1).toNanos())
                    .maximumExpectedValue((double) Duration.ofSeconds(30).toNanos())
                    .build()
                    .merge(config);
            }
        };
    }
}
