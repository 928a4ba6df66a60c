package com.omnimcp.gateway.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JSON-RPC response envelope")
class JsonRpcResponseTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void errorEnvelopeCarriesErrorObject() throws Exception {
        JsonRpcResponse response = JsonRpcResponse.error(IntNode.valueOf(42),
            JsonRpcError.METHOD_NOT_FOUND, "Method not found", "No server found for capability: nope");

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(response));

        assertThat(json.get("id").isInt()).isTrue();
        assertThat(json.get("id").asInt()).isEqualTo(42);
        assertThat(json.path("error").path("code").asInt()).isEqualTo(-32601);
        assertThat(json.path("error").path("message").asText()).isEqualTo("Method not found");
        assertThat(json.path("error").path("data").asText()).isEqualTo("No server found for capability: nope");
        assertThat(json.has("result")).isFalse();
        assertThat(json.has("hasError")).isFalse();
    }

    @Test
    void unknownIdIsWrittenAsNull() throws Exception {
        JsonRpcResponse response = JsonRpcResponse.error(null, new JsonRpcError(JsonRpcError.PARSE_ERROR, "Parse error"));

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(response));

        assertThat(json.has("id")).isTrue();
        assertThat(json.get("id").isNull()).isTrue();
        assertThat(json.path("error").path("code").asInt()).isEqualTo(-32700);
        assertThat(json.path("error").has("data")).isFalse();
    }

    @Test
    void backendErrorEnvelopeIsReadBack() throws Exception {
        JsonRpcResponse response = objectMapper.readValue(
            "{\"jsonrpc\":\"2.0\",\"id\":7,\"error\":{\"code\":-32602,\"message\":\"Invalid params\","
                + "\"data\":{\"field\":\"query\"}}}",
            JsonRpcResponse.class);

        assertThat(response.hasError()).isTrue();
        assertThat(response.getError().getCode()).isEqualTo(-32602);
        assertThat(response.getError().getMessage()).isEqualTo("Invalid params");
        assertThat(response.getId()).isEqualTo(IntNode.valueOf(7));
    }

    @Test
    void successEnvelopeHasNoError() throws Exception {
        JsonRpcResponse response = JsonRpcResponse.success(TextNode.valueOf("abc"),
            objectMapper.createObjectNode().put("ok", true));

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(response));

        assertThat(json.get("id").asText()).isEqualTo("abc");
        assertThat(json.path("result").path("ok").asBoolean()).isTrue();
        assertThat(json.has("error")).isFalse();
        assertThat(response.hasError()).isFalse();
    }
}
