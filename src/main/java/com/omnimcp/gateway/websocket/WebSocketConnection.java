package com.omnimcp.gateway.websocket;

/**
 * Handle to an open client socket, as seen by sessions and the gateway.
 */
public interface WebSocketConnection {

    String getId();

    /**
     * Queues a text frame. Returns false when the socket is already closed.
     */
    boolean send(String text);

    void close();

    boolean isOpen();
}
