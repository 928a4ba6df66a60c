package com.omnimcp.gateway.exception;

/**
 * Outbound call to a capability server failed before a JSON-RPC response
 * could be read.
 */
public class BackendCallException extends RuntimeException {

    private final String backendId;

    public BackendCallException(String backendId, String message, Throwable cause) {
        super(message, cause);
        this.backendId = backendId;
    }

    public String getBackendId() {
        return backendId;
    }
}
