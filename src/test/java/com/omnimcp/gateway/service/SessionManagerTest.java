package com.omnimcp.gateway.service;

import com.omnimcp.gateway.config.GatewayProperties;
import com.omnimcp.gateway.model.Session;
import com.omnimcp.gateway.model.Transport;
import com.omnimcp.gateway.support.MutableClock;
import com.omnimcp.gateway.websocket.WebSocketConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Session manager")
class SessionManagerTest {

    private MutableClock clock;
    private SessionManager sessionManager;

    @Mock
    private WebSocketConnection connection;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        GatewayProperties properties = new GatewayProperties();
        properties.setJwtSecret("session-manager-test-secret-0123456789");
        properties.setMaxConcurrentSessions(2);
        properties.setSessionTimeout(Duration.ofMinutes(10));
        properties.setTokenExpiry(Duration.ofHours(1));
        sessionManager = new SessionManager(properties, new SessionTokenService(properties, clock), clock);
    }

    @AfterEach
    void tearDown() {
        sessionManager.shutdown();
    }

    @Nested
    @DisplayName("Capacity")
    class Capacity {

        @Test
        void refusesSessionsBeyondMaximum() {
            assertThat(sessionManager.createSession(null, Transport.HTTP)).isPresent();
            assertThat(sessionManager.createSession("user", Transport.HTTP)).isPresent();

            assertThat(sessionManager.canCreateNewSession()).isFalse();
            assertThat(sessionManager.createSession("late", Transport.HTTP)).isEmpty();
            assertThat(sessionManager.getActiveSessionCount()).isEqualTo(2);
        }

        @Test
        void removingSessionFreesSlot() {
            Session first = sessionManager.createSession(null, Transport.HTTP).orElseThrow();
            sessionManager.createSession(null, Transport.HTTP).orElseThrow();

            sessionManager.removeSession(first.getId());
            sessionManager.removeSession(first.getId());

            assertThat(sessionManager.getActiveSessionCount()).isEqualTo(1);
            assertThat(sessionManager.canCreateNewSession()).isTrue();
        }

        @Test
        void anonymousUserIsDefaulted() {
            Session session = sessionManager.createSession(null, Transport.HTTP).orElseThrow();

            assertThat(session.getUserId()).isEqualTo(SessionManager.ANONYMOUS_USER);
            assertThat(session.getTransport()).isEqualTo(Transport.HTTP);
        }
    }

    @Nested
    @DisplayName("Expiry")
    class Expiry {

        @Test
        void lookupSlidesExpiration() {
            Session session = sessionManager.createSession(null, Transport.HTTP).orElseThrow();

            clock.advance(Duration.ofMinutes(8));
            assertThat(sessionManager.getSession(session.getId())).isPresent();
            clock.advance(Duration.ofMinutes(8));

            assertThat(sessionManager.getSession(session.getId())).isPresent();
            assertThat(session.getLastActivity()).isEqualTo(clock.instant());
        }

        @Test
        void idleSessionIsGoneOnLookup() {
            Session session = sessionManager.createSession(null, Transport.HTTP).orElseThrow();

            clock.advance(Duration.ofMinutes(11));

            assertThat(sessionManager.getSession(session.getId())).isEmpty();
            assertThat(sessionManager.getActiveSessionCount()).isZero();
        }

        @Test
        void sweepRemovesIdleSessionsAndClosesTheirSockets() {
            when(connection.isOpen()).thenReturn(true);
            Session idle = sessionManager.createSession(null, Transport.HTTP).orElseThrow();
            sessionManager.attachWebSocket(idle.getId(), connection);
            clock.advance(Duration.ofMinutes(6));
            Session active = sessionManager.createSession(null, Transport.HTTP).orElseThrow();
            clock.advance(Duration.ofMinutes(5));

            int removed = sessionManager.sweepExpiredSessions();

            assertThat(removed).isEqualTo(1);
            assertThat(sessionManager.getSession(idle.getId())).isEmpty();
            assertThat(sessionManager.getSession(active.getId())).isPresent();
            verify(connection).close();
            assertThat(idle.getAttributes()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Tokens")
    class Tokens {

        @Test
        void bearerHeaderResolvesSession() {
            Session session = sessionManager.createSession(null, Transport.HTTP).orElseThrow();
            String token = sessionManager.generateToken(session.getId());

            Optional<Session> resolved = sessionManager.getSessionFromAuthHeader("Bearer " + token);

            assertThat(resolved).containsSame(session);
        }

        @Test
        void headerWithoutBearerPrefixIsIgnored() {
            Session session = sessionManager.createSession(null, Transport.HTTP).orElseThrow();
            String token = sessionManager.generateToken(session.getId());

            assertThat(sessionManager.getSessionFromAuthHeader(token)).isEmpty();
            assertThat(sessionManager.getSessionFromAuthHeader(null)).isEmpty();
        }

        @Test
        void tokenCanExpireBeforeSessionDoes() {
            GatewayProperties properties = new GatewayProperties();
            properties.setJwtSecret("session-manager-test-secret-0123456789");
            properties.setSessionTimeout(Duration.ofHours(3));
            properties.setTokenExpiry(Duration.ofHours(1));
            SessionManager manager = new SessionManager(properties, new SessionTokenService(properties, clock), clock);
            Session session = manager.createSession(null, Transport.HTTP).orElseThrow();
            String token = manager.generateToken(session.getId());

            clock.advance(Duration.ofMinutes(90));

            assertThat(manager.getSessionFromToken(token)).isEmpty();
            assertThat(manager.getSession(session.getId())).isPresent();
        }

        @Test
        void tokenForRemovedSessionResolvesNothing() {
            Session session = sessionManager.createSession(null, Transport.HTTP).orElseThrow();
            String token = sessionManager.generateToken(session.getId());

            sessionManager.removeSession(session.getId());

            assertThat(sessionManager.getSessionFromToken(token)).isEmpty();
        }
    }

    @Test
    void attachingNewSocketClosesPreviousOne() {
        WebSocketConnection replacement = mock(WebSocketConnection.class);
        Session session = sessionManager.createSession(null, Transport.HTTP).orElseThrow();

        assertThat(sessionManager.attachWebSocket(session.getId(), connection)).isTrue();
        assertThat(sessionManager.attachWebSocket(session.getId(), replacement)).isTrue();

        verify(connection).close();
        verify(replacement, never()).close();
        assertThat(session.getConnection()).isSameAs(replacement);
        assertThat(session.getTransport()).isEqualTo(Transport.WEBSOCKET);
        assertThat(sessionManager.attachWebSocket("missing", connection)).isFalse();
    }
}
