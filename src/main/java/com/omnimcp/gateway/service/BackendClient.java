package com.omnimcp.gateway.service;

import com.omnimcp.gateway.exception.BackendCallException;
import com.omnimcp.gateway.model.BackendDescriptor;
import com.omnimcp.gateway.model.JsonRpcRequest;
import com.omnimcp.gateway.model.JsonRpcResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.net.ConnectException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Outbound HTTP calls to capability servers: {@code GET /health} and
 * {@code POST /mcp}.
 */
@Component
@Slf4j
public class BackendClient {

    static final String HEALTH_PATH = "/health";
    static final String MCP_PATH = "/mcp";

    private final WebClient webClient;

    public BackendClient(WebClient.Builder webClientBuilder) {
        this.webClient = webClientBuilder.build();
    }

    /**
     * Emits true for any 2xx answer, false for anything else including
     * timeouts and network errors. Never errors.
     */
    public Mono<Boolean> probeHealth(BackendDescriptor backend, Duration timeout) {
        return webClient.get()
            .uri(backend.getBaseUrl() + HEALTH_PATH)
            .exchangeToMono(response -> response.releaseBody()
                .thenReturn(response.statusCode().is2xxSuccessful()))
            .timeout(timeout)
            .doOnError(error -> log.debug("Health probe for {} failed: {}", backend.getId(), error.toString()))
            .onErrorReturn(false);
    }

    /**
     * Posts the envelope to the backend's {@code /mcp} endpoint and returns
     * the backend's JSON-RPC response as-is, including error responses and
     * JSON bodies sent with a non-2xx status. Only connection refusals are
     * retried, up to the backend's {@code maxRetries}.
     */
    public Mono<JsonRpcResponse> call(BackendDescriptor backend, JsonRpcRequest request, Duration timeout) {
        return webClient.post()
            .uri(backend.getBaseUrl() + MCP_PATH)
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.APPLICATION_JSON)
            .bodyValue(request)
            .exchangeToMono(response -> response.bodyToMono(JsonRpcResponse.class)
                .switchIfEmpty(Mono.error(new IllegalStateException(
                    "Empty response body with status " + response.statusCode().value()))))
            .retryWhen(Retry.max(backend.getMaxRetries())
                .filter(BackendClient::isConnectionRefused)
                .onRetryExhaustedThrow((retry, signal) -> signal.failure()))
            .timeout(timeout)
            .onErrorMap(error -> !(error instanceof BackendCallException),
                error -> new BackendCallException(backend.getId(),
                    String.format("Call to %s%s failed: %s", backend.getBaseUrl(), MCP_PATH, describe(error, timeout)),
                    error));
    }

    private static boolean isConnectionRefused(Throwable error) {
        return error instanceof WebClientRequestException && error.getCause() instanceof ConnectException;
    }

    private static String describe(Throwable error, Duration timeout) {
        if (error instanceof TimeoutException) {
            return "no response within " + timeout.toMillis() + "ms";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
