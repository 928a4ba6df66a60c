package com.omnimcp.gateway.exception;

import com.omnimcp.gateway.model.JsonRpcError;

/**
 * Failure that maps onto a JSON-RPC error object.
 */
public class JsonRpcException extends RuntimeException {

    private final int code;
    private final Object data;

    public JsonRpcException(int code, String message, Object data) {
        super(message);
        this.code = code;
        this.data = data;
    }

    public JsonRpcException(int code, String message) {
        this(code, message, null);
    }

    public int getCode() {
        return code;
    }

    public Object getData() {
        return data;
    }

    public JsonRpcError toError() {
        return new JsonRpcError(code, getMessage(), data);
    }

    public static JsonRpcException parseError(String detail) {
        return new JsonRpcException(JsonRpcError.PARSE_ERROR, "Parse error", detail);
    }

    public static JsonRpcException invalidRequest(String detail) {
        return new JsonRpcException(JsonRpcError.INVALID_REQUEST, "Invalid Request", detail);
    }

    public static JsonRpcException invalidParams(String detail) {
        return new JsonRpcException(JsonRpcError.INVALID_PARAMS, "Invalid params", detail);
    }
}
