package com.omnimcp.gateway.service;

import com.omnimcp.gateway.config.GatewayProperties;
import com.omnimcp.gateway.model.Session;
import com.omnimcp.gateway.model.Transport;
import com.omnimcp.gateway.websocket.WebSocketConnection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session lifecycle and admission control. Sessions live in memory only.
 */
@Service
@Slf4j
public class SessionManager {

    private static final String BEARER_PREFIX = "Bearer ";
    public static final String ANONYMOUS_USER = "anonymous";

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final SessionTokenService tokenService;
    private final Clock clock;
    private final Duration sessionTimeout;
    private final Duration sweepInterval;
    private final int maxConcurrentSessions;

    private volatile Disposable sweeper;

    public SessionManager(GatewayProperties properties, SessionTokenService tokenService, Clock clock) {
        this.tokenService = tokenService;
        this.clock = clock;
        this.sessionTimeout = properties.getSessionTimeout();
        this.sweepInterval = properties.getSessionSweepInterval();
        this.maxConcurrentSessions = properties.getMaxConcurrentSessions();
    }

    public void start() {
        if (sweeper != null && !sweeper.isDisposed()) {
            return;
        }
        sweeper = Flux.interval(sweepInterval, sweepInterval)
            .onBackpressureDrop()
            .subscribe(
                tick -> sweepExpiredSessions(),
                error -> log.error("Session sweep stopped", error));
    }

    public void shutdown() {
        if (sweeper != null) {
            sweeper.dispose();
        }
        for (Session session : sessions.values()) {
            closeConnection(session);
        }
        sessions.clear();
    }

    /**
     * Creates a session, or returns empty when the gateway is at capacity.
     * Callers are expected to check {@link #canCreateNewSession()} first.
     */
    public synchronized Optional<Session> createSession(String userId, Transport transport) {
        if (!canCreateNewSession()) {
            log.warn("Session limit of {} reached, refusing new {} session", maxConcurrentSessions, transport.getValue());
            return Optional.empty();
        }
        String owner = userId != null ? userId : ANONYMOUS_USER;
        Session session = new Session(UUID.randomUUID().toString(), owner, transport, clock.instant());
        sessions.put(session.getId(), session);
        log.debug("Created new session: {} for user: {}", session.getId(), owner);
        return Optional.of(session);
    }

    public boolean canCreateNewSession() {
        return sessions.size() < maxConcurrentSessions;
    }

    /**
     * Looks up a session and slides its expiration forward.
     */
    public Optional<Session> getSession(String sessionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        Session session = sessions.get(sessionId);
        if (session == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        if (session.isIdleSince(now, sessionTimeout)) {
            removeSession(sessionId);
            return Optional.empty();
        }
        session.touch(now);
        return Optional.of(session);
    }

    /**
     * Binds a socket to an existing session so frames on it run under that
     * session without re-authentication.
     */
    public boolean attachWebSocket(String sessionId, WebSocketConnection connection) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            return false;
        }
        WebSocketConnection previous = session.getConnection();
        session.bind(connection);
        if (previous != null && previous != connection) {
            previous.close();
        }
        return true;
    }

    public String generateToken(String sessionId) {
        return tokenService.generateToken(sessionId);
    }

    public Optional<String> validateToken(String token) {
        return tokenService.validateToken(token);
    }

    public Optional<Session> getSessionFromToken(String token) {
        return validateToken(token).flatMap(this::getSession);
    }

    public Optional<Session> getSessionFromAuthHeader(String authHeader) {
        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            return Optional.empty();
        }
        return getSessionFromToken(authHeader.substring(BEARER_PREFIX.length()).trim());
    }

    public void removeSession(String sessionId) {
        Session session = sessions.remove(sessionId);
        if (session != null) {
            session.getAttributes().clear();
            closeConnection(session);
            log.debug("Removed session: {}", sessionId);
        }
    }

    public int getActiveSessionCount() {
        return sessions.size();
    }

    public int getMaxConcurrentSessions() {
        return maxConcurrentSessions;
    }

    /**
     * Removes every session idle for longer than the session timeout and
     * closes its socket.
     *
     * @return number of sessions removed
     */
    public int sweepExpiredSessions() {
        Instant now = clock.instant();
        List<String> expired = new ArrayList<>();
        sessions.forEach((id, session) -> {
            if (session.isIdleSince(now, sessionTimeout)) {
                expired.add(id);
            }
        });

        for (String sessionId : expired) {
            removeSession(sessionId);
            log.debug("Cleaned up expired session: {}", sessionId);
        }
        if (!expired.isEmpty()) {
            log.info("Cleaned up {} expired sessions", expired.size());
        }
        return expired.size();
    }

    private void closeConnection(Session session) {
        WebSocketConnection connection = session.getConnection();
        if (connection != null && connection.isOpen()) {
            connection.close();
        }
    }
}
