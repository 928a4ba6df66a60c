package com.omnimcp.gateway.model;

import com.omnimcp.gateway.websocket.WebSocketConnection;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Logical client context. Owned by the session manager; request handlers
 * only borrow it.
 */
@Getter
public class Session {

    private final String id;
    private final String userId;
    private final Instant createdAt;
    private volatile Instant lastActivity;
    private volatile Transport transport;
    private volatile WebSocketConnection connection;

    /** Connection-scoped state, discarded when the session is removed. */
    private final Map<String, Object> attributes = new ConcurrentHashMap<>();

    public Session(String id, String userId, Transport transport, Instant now) {
        this.id = id;
        this.userId = userId;
        this.transport = transport;
        this.createdAt = now;
        this.lastActivity = now;
    }

    public void touch(Instant now) {
        this.lastActivity = now;
    }

    public void bind(WebSocketConnection connection) {
        this.connection = connection;
        this.transport = Transport.WEBSOCKET;
    }

    public boolean isIdleSince(Instant now, Duration timeout) {
        return Duration.between(lastActivity, now).compareTo(timeout) > 0;
    }
}
