package com.omnimcp.gateway.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inbound JSON-RPC 2.0 request.
 * The {@code id} is kept as a raw JSON node so a numeric id is relayed as a
 * number and a string id as a string.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JsonRpcRequest {

    public static final String VERSION = "2.0";

    @Builder.Default
    private String jsonrpc = VERSION;

    private JsonNode id;

    private String method;

    private ObjectNode params;

    /**
     * String value of a params field, or null when absent or not textual.
     */
    @JsonIgnore
    public String getParamText(String field) {
        if (params == null) {
            return null;
        }
        JsonNode value = params.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
