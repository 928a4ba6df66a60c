package com.omnimcp.gateway.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.omnimcp.gateway.config.GatewayProperties;
import com.omnimcp.gateway.model.Session;
import com.omnimcp.gateway.service.McpGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Bidirectional JSON-RPC over {@code /mcp/ws}. A {@code token} query
 * parameter resumes an existing session; otherwise each socket gets its own.
 */
@Component
@Slf4j
public class McpWebSocketHandler implements WebSocketHandler {

    static final String TOKEN_PARAM = "token";

    private final McpGateway gateway;
    private final ObjectMapper objectMapper;
    private final boolean sequential;

    public McpWebSocketHandler(McpGateway gateway, ObjectMapper objectMapper, GatewayProperties properties) {
        this.gateway = gateway;
        this.objectMapper = objectMapper;
        this.sequential = properties.getWebsocket().isSequential();
    }

    @Override
    public Mono<Void> handle(WebSocketSession webSocketSession) {
        ReactiveWebSocketConnection connection = new ReactiveWebSocketConnection(webSocketSession);
        String token = UriComponentsBuilder.fromUri(webSocketSession.getHandshakeInfo().getUri())
            .build()
            .getQueryParams()
            .getFirst(TOKEN_PARAM);

        Optional<Session> opened = gateway.openWebSocketSession(token, connection);
        if (opened.isEmpty()) {
            log.warn("Rejecting WebSocket {}: session limit reached", webSocketSession.getId());
            return webSocketSession.send(Mono.just(webSocketSession.textMessage(toJson(gateway.capacityError(null)))))
                .then(webSocketSession.close(CloseStatus.SERVICE_OVERLOAD));
        }

        Session session = opened.get();
        log.info("New WebSocket connection established: {}", session.getId());
        connection.send(toJson(gateway.welcomeMessage(session)));

        Flux<String> frames = webSocketSession.receive().map(WebSocketMessage::getPayloadAsText);
        Mono<Void> input = (sequential
                ? frames.concatMap(frame -> handleFrame(session, connection, frame))
                : frames.flatMap(frame -> handleFrame(session, connection, frame)))
            .then()
            .doFinally(signal -> connection.close());

        Mono<Void> output = webSocketSession.send(connection.outbound().map(webSocketSession::textMessage));

        return Mono.when(input, output)
            .doOnError(error -> log.error("WebSocket error for session {}", session.getId(), error))
            .doFinally(signal -> gateway.closeWebSocketSession(session, connection));
    }

    private Mono<Void> handleFrame(Session session, WebSocketConnection connection, String frame) {
        return gateway.handleWebSocketMessage(session, connection, frame)
            .onErrorResume(error -> {
                log.error("Error handling WebSocket message on session {}", session.getId(), error);
                return Mono.empty();
            });
    }

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize WebSocket frame", e);
        }
    }
}
