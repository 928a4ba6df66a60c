package com.omnimcp.gateway.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gateway settings bound from {@code gateway.*}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    /** HMAC secret for session tokens. Generated at startup when blank. */
    private String jwtSecret;

    private String apiKey;

    private boolean requireApiKey = false;

    @NotNull
    private Duration sessionTimeout = Duration.ofHours(1);

    @NotNull
    private Duration sessionSweepInterval = Duration.ofSeconds(60);

    @NotNull
    private Duration tokenExpiry = Duration.ofHours(1);

    @Min(1)
    private int maxConcurrentSessions = 100;

    @NotNull
    private Duration healthCheckTimeout = Duration.ofSeconds(5);

    @NotNull
    private Duration proxyTimeout = Duration.ofSeconds(30);

    @NotNull
    private Duration fanOutTimeout = Duration.ofSeconds(10);

    @Min(1)
    private int fanOutConcurrency = 4;

    @NotNull
    private DataSize maxRequestSize = DataSize.ofMegabytes(1);

    private boolean securityHeaders = false;

    @Valid
    private RateLimit rateLimit = new RateLimit();

    @Valid
    private Cors cors = new Cors();

    @Valid
    private WebSocket websocket = new WebSocket();

    @Valid
    private Sse sse = new Sse();

    /** Capability servers keyed by backend id, in declaration order. */
    @Valid
    private Map<String, Server> servers = new LinkedHashMap<>();

    @Data
    public static class RateLimit {
        private boolean enabled = false;

        @Min(1)
        private int perMinute = 1000;

        /** Upper bound on tracked client buckets. */
        @Min(1)
        private long maxClients = 10_000;
    }

    @Data
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:8080"));
        private boolean allowCredentials = true;
    }

    @Data
    public static class WebSocket {
        /** Process frames of one connection one at a time, keeping response order. */
        private boolean sequential = false;
    }

    @Data
    public static class Sse {
        @NotNull
        private Duration keepAliveInterval = Duration.ofSeconds(30);
    }

    @Data
    public static class Server {
        private String url;
        private boolean enabled = true;
        private String description;
        private List<String> tools = new ArrayList<>();
        private List<String> resources = new ArrayList<>();
        private List<String> prompts = new ArrayList<>();

        @NotNull
        private Duration healthCheckInterval = Duration.ofSeconds(30);

        private boolean requiresAuth = false;

        @Min(0)
        private int maxRetries = 0;
    }
}
