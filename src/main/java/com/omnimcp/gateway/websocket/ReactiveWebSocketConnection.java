package com.omnimcp.gateway.websocket;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Adapts a reactive {@link WebSocketSession} to the push-style
 * {@link WebSocketConnection}. Frames are buffered in a sink that the
 * handler drains into the session's outbound stream.
 */
@Slf4j
class ReactiveWebSocketConnection implements WebSocketConnection {

    private final WebSocketSession session;
    private final Sinks.Many<String> outbound = Sinks.many().unicast().onBackpressureBuffer();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    ReactiveWebSocketConnection(WebSocketSession session) {
        this.session = session;
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public boolean send(String text) {
        if (closed.get()) {
            return false;
        }
        // Frames are produced from several reactor threads at once.
        synchronized (outbound) {
            return outbound.tryEmitNext(text).isSuccess();
        }
    }

    @Override
    public void close() {
        close(CloseStatus.NORMAL);
    }

    void close(CloseStatus status) {
        if (closed.compareAndSet(false, true)) {
            synchronized (outbound) {
                outbound.tryEmitComplete();
            }
            session.close(status).subscribe(
                null,
                error -> log.debug("Error closing WebSocket {}: {}", getId(), error.getMessage()));
        }
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && session.isOpen();
    }

    Flux<String> outbound() {
        return outbound.asFlux();
    }
}
