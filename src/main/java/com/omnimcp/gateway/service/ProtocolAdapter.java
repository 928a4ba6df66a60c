package com.omnimcp.gateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.omnimcp.gateway.exception.JsonRpcException;
import com.omnimcp.gateway.model.CapabilityMap;
import com.omnimcp.gateway.model.JsonRpcRequest;
import com.omnimcp.gateway.model.JsonRpcResponse;
import com.omnimcp.gateway.model.RoutedMethod;
import com.omnimcp.gateway.websocket.WebSocketConnection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Stateless translation between wire payloads and {@link JsonRpcRequest},
 * plus capability resolution.
 */
@Component
@Slf4j
public class ProtocolAdapter {

    private final ObjectMapper objectMapper;

    public ProtocolAdapter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Validates an HTTP body. Violations surface as {@link JsonRpcException}
     * for the caller to turn into an error envelope.
     */
    public JsonRpcRequest parseHttpRequest(JsonNode body) {
        return toRequest(body);
    }

    /**
     * Parses one text frame. On failure an error response is written to the
     * socket directly and empty is returned.
     */
    public Optional<JsonRpcRequest> parseWebSocketMessage(WebSocketConnection connection, String message) {
        JsonNode node = null;
        try {
            node = objectMapper.readTree(message);
            return Optional.of(toRequest(node));
        } catch (JsonProcessingException e) {
            log.error("Error parsing WebSocket message: {}", e.getOriginalMessage());
            sendWebSocketResponse(connection, JsonRpcResponse.error(null,
                JsonRpcException.parseError(e.getOriginalMessage()).toError()));
            return Optional.empty();
        } catch (JsonRpcException e) {
            log.error("Invalid JSON-RPC message over WebSocket: {}", e.getData());
            sendWebSocketResponse(connection, JsonRpcResponse.error(extractId(node), e.toError()));
            return Optional.empty();
        }
    }

    public void sendWebSocketResponse(WebSocketConnection connection, JsonRpcResponse response) {
        try {
            if (!connection.send(objectMapper.writeValueAsString(response))) {
                log.warn("Dropped response for closed WebSocket {}", connection.getId());
            }
        } catch (JsonProcessingException e) {
            log.error("Error sending WebSocket response", e);
        }
    }

    /**
     * The name a backend must declare to own this request.
     */
    public String routingKey(JsonRpcRequest request) {
        return RoutedMethod.fromWireName(request.getMethod())
            .map(routed -> request.getParamText(routed.getKeyField()))
            .orElse(request.getMethod());
    }

    public Optional<String> resolveCapability(JsonRpcRequest request, CapabilityMap capabilityMap) {
        String capability = routingKey(request);
        log.debug("Resolving capability {} for method {}", capability, request.getMethod());

        Optional<String> owner = capabilityMap.findOwner(capability);
        if (owner.isPresent()) {
            log.debug("Found server {} for capability {}", owner.get(), capability);
        } else {
            log.warn("Could not resolve capability for: {}", capability);
        }
        return owner;
    }

    /**
     * Best-effort id of a payload that may not be a valid request, so error
     * responses still echo it.
     */
    public JsonNode extractId(JsonNode body) {
        if (body == null || !body.isObject()) {
            return null;
        }
        JsonNode id = body.get("id");
        return id != null && (id.isTextual() || id.isNumber()) ? id : null;
    }

    private JsonRpcRequest toRequest(JsonNode body) {
        if (body == null || !body.isObject()) {
            throw JsonRpcException.invalidRequest("Request body must be a JSON object");
        }
        if (!JsonRpcRequest.VERSION.equals(body.path("jsonrpc").asText(null))) {
            throw JsonRpcException.invalidRequest("jsonrpc field must be '2.0'");
        }
        JsonNode method = body.get("method");
        if (method == null || !method.isTextual() || method.asText().isEmpty()) {
            throw JsonRpcException.invalidRequest("method field is required and must be a string");
        }
        JsonNode id = body.get("id");
        if (id != null && !id.isNull() && !id.isTextual() && !id.isNumber()) {
            throw JsonRpcException.invalidRequest("id field must be a string or number if provided");
        }
        JsonNode params = body.get("params");
        if (params != null && !params.isNull() && !params.isObject()) {
            throw JsonRpcException.invalidRequest("params field must be an object if provided");
        }

        JsonRpcRequest request = JsonRpcRequest.builder()
            .id(id == null || id.isNull() ? null : id)
            .method(method.asText())
            .params(params == null || params.isNull() ? null : (ObjectNode) params)
            .build();

        validateRoutingParams(request);
        return request;
    }

    private void validateRoutingParams(JsonRpcRequest request) {
        Optional<RoutedMethod> routed = RoutedMethod.fromWireName(request.getMethod());
        if (routed.isEmpty()) {
            return;
        }
        String keyField = routed.get().getKeyField();
        if (request.getParamText(keyField) == null) {
            throw JsonRpcException.invalidParams(String.format(
                "params.%s is required for %s", keyField, request.getMethod()));
        }
        if (routed.get() == RoutedMethod.TOOLS_CALL) {
            JsonNode arguments = request.getParams().get("arguments");
            if (arguments != null && !arguments.isNull() && !arguments.isObject()) {
                throw JsonRpcException.invalidParams("params.arguments must be an object if provided");
            }
        }
    }
}
