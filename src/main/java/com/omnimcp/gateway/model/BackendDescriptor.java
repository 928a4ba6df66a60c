package com.omnimcp.gateway.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.Set;

/**
 * Static description of a capability server, fixed at startup.
 */
@Value
@Builder
public class BackendDescriptor {

    String id;
    String baseUrl;
    String description;

    /** Tools, then resources, then prompts, in declaration order. */
    @Singular
    Set<String> capabilities;

    @Builder.Default
    Duration healthCheckInterval = Duration.ofSeconds(30);

    boolean requiresAuth;

    int maxRetries;
}
