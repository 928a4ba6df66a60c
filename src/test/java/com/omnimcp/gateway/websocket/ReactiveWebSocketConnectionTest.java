package com.omnimcp.gateway.websocket;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReactiveWebSocketConnectionTest {

    @Mock
    private WebSocketSession session;

    private ReactiveWebSocketConnection connection;

    @BeforeEach
    void setUp() {
        connection = new ReactiveWebSocketConnection(session);
    }

    @Test
    void queuedFramesAreDrainedInOrderUntilClose() {
        when(session.close(any(CloseStatus.class))).thenReturn(Mono.empty());

        assertThat(connection.send("one")).isTrue();
        assertThat(connection.send("two")).isTrue();
        connection.close();

        StepVerifier.create(connection.outbound())
            .expectNext("one", "two")
            .verifyComplete();
        verify(session).close(CloseStatus.NORMAL);
    }

    @Test
    void sendAfterCloseIsRejected() {
        when(session.close(any(CloseStatus.class))).thenReturn(Mono.empty());

        connection.close(CloseStatus.SERVICE_OVERLOAD);
        connection.close();

        assertThat(connection.send("late")).isFalse();
        assertThat(connection.isOpen()).isFalse();
        verify(session, times(1)).close(any(CloseStatus.class));
    }

    @Test
    void openWhileUnderlyingSessionIsOpen() {
        when(session.isOpen()).thenReturn(true);

        assertThat(connection.isOpen()).isTrue();
    }
}
