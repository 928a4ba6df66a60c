package com.omnimcp.gateway.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.omnimcp.gateway.config.GatewayProperties;
import com.omnimcp.gateway.dto.GatewayHealthResponse;
import com.omnimcp.gateway.dto.GatewayHttpResponse;
import com.omnimcp.gateway.model.JsonRpcResponse;
import com.omnimcp.gateway.service.McpGateway;
import com.omnimcp.gateway.sse.SseConnectionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP surface of the gateway: JSON-RPC over POST, health, and the
 * push-only SSE stream.
 */
@RestController
@Slf4j
public class McpController {

    public static final String SESSION_TOKEN_HEADER = "Mcp-Session-Token";

    private final McpGateway gateway;
    private final SseConnectionRegistry sseConnections;
    private final Clock clock;
    private final Duration keepAliveInterval;

    public McpController(McpGateway gateway,
                         SseConnectionRegistry sseConnections,
                         Clock clock,
                         GatewayProperties properties) {
        this.gateway = gateway;
        this.sseConnections = sseConnections;
        this.clock = clock;
        this.keepAliveInterval = properties.getSse().getKeepAliveInterval();
    }

    @PostMapping(value = {"/mcp", "/messages"},
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<JsonRpcResponse>> handleJsonRpc(@RequestBody JsonNode body,
                                                               @RequestHeader HttpHeaders headers) {
        return gateway.handleHttpRequest(body, headers).map(this::toResponseEntity);
    }

    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<GatewayHealthResponse> health() {
        return Mono.fromSupplier(() -> GatewayHealthResponse.builder()
            .status("healthy")
            .timestamp(clock.instant().toString())
            .servers(gateway.getHealthStatus())
            .build());
    }

    @GetMapping(value = "/sse", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<Object>> sse() {
        String connectionId = sseConnections.open();

        Map<String, Object> hello = new LinkedHashMap<>();
        hello.put("type", "connection");
        hello.put("sessionId", connectionId);

        Flux<ServerSentEvent<Object>> keepAlive = Flux.interval(keepAliveInterval)
            .map(tick -> ServerSentEvent.builder().comment(" keep-alive").build());

        return Flux.concat(Mono.just(ServerSentEvent.builder().data((Object) hello).build()), keepAlive)
            .takeUntilOther(sseConnections.closeSignal(connectionId))
            .doFinally(signal -> sseConnections.close(connectionId));
    }

    private ResponseEntity<JsonRpcResponse> toResponseEntity(GatewayHttpResponse response) {
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(response.getStatus());
        if (response.getSessionToken() != null) {
            builder.header(SESSION_TOKEN_HEADER, response.getSessionToken());
        }
        return builder.body(response.getBody());
    }
}
