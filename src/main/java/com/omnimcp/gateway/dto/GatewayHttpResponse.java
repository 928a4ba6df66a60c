package com.omnimcp.gateway.dto;

import com.omnimcp.gateway.model.JsonRpcResponse;
import lombok.Value;
import org.springframework.http.HttpStatus;

/**
 * Result of handling one HTTP JSON-RPC call: the envelope, the HTTP status it
 * travels with, and a session token when the call opened a new session.
 */
@Value
public class GatewayHttpResponse {

    HttpStatus status;
    JsonRpcResponse body;
    String sessionToken;

    public static GatewayHttpResponse ok(JsonRpcResponse body, String sessionToken) {
        return new GatewayHttpResponse(HttpStatus.OK, body, sessionToken);
    }

    public static GatewayHttpResponse of(HttpStatus status, JsonRpcResponse body) {
        return new GatewayHttpResponse(status, body, null);
    }
}
