package com.omnimcp.gateway.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outbound JSON-RPC 2.0 response. Exactly one of {@code result} or
 * {@code error} is set.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class JsonRpcResponse {

    @Builder.Default
    private String jsonrpc = JsonRpcRequest.VERSION;

    /** Written as {@code null} when the request id is unknown. */
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private JsonNode id;

    private JsonNode result;

    private JsonRpcError error;

    public static JsonRpcResponse success(JsonNode id, JsonNode result) {
        return JsonRpcResponse.builder().id(id).result(result).build();
    }

    public static JsonRpcResponse error(JsonNode id, int code, String message, Object data) {
        return JsonRpcResponse.builder().id(id).error(new JsonRpcError(code, message, data)).build();
    }

    public static JsonRpcResponse error(JsonNode id, JsonRpcError error) {
        return JsonRpcResponse.builder().id(id).error(error).build();
    }

    @JsonIgnore
    public boolean hasError() {
        return error != null;
    }
}
