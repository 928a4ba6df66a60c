package com.omnimcp.gateway.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Transport-level failures. JSON-RPC level errors never reach here; they are
 * returned inside the envelope with HTTP 200.
 */
@RestControllerAdvice
@Slf4j
public class GatewayExceptionHandler {

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleMalformedBody(ServerWebInputException ex) {
        log.warn("Rejected malformed request body: {}", ex.getReason());
        return error(HttpStatus.BAD_REQUEST, "Bad request", "Request body must be a valid JSON object");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex) {
        log.error("Unhandled gateway error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error",
            ex.getMessage() != null ? ex.getMessage() : "An unexpected error occurred");
    }

    static ResponseEntity<Map<String, Object>> error(HttpStatus status, String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        return ResponseEntity.status(status).body(body);
    }
}
