package com.omnimcp.gateway.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.omnimcp.gateway.config.BackendRegistry;
import com.omnimcp.gateway.config.GatewayProperties;
import com.omnimcp.gateway.dto.BackendHealthStatus;
import com.omnimcp.gateway.dto.GatewayHttpResponse;
import com.omnimcp.gateway.exception.BackendCallException;
import com.omnimcp.gateway.exception.JsonRpcException;
import com.omnimcp.gateway.model.BackendDescriptor;
import com.omnimcp.gateway.model.BackendInstance;
import com.omnimcp.gateway.model.CapabilityMap;
import com.omnimcp.gateway.model.JsonRpcError;
import com.omnimcp.gateway.model.JsonRpcRequest;
import com.omnimcp.gateway.model.JsonRpcResponse;
import com.omnimcp.gateway.model.ProtocolMethod;
import com.omnimcp.gateway.model.Session;
import com.omnimcp.gateway.model.Transport;
import com.omnimcp.gateway.monitoring.GatewayMetrics;
import com.omnimcp.gateway.monitoring.McpRequestLogger;
import com.omnimcp.gateway.websocket.WebSocketConnection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for every JSON-RPC call regardless of transport. Resolves the
 * session, answers protocol methods locally, and relays everything else to
 * the backend that owns the requested capability.
 */
@Service
@Slf4j
public class McpGateway {

    public static final String PROTOCOL_VERSION = "2024-11-05";
    public static final String SERVER_NAME = "omni-mcp-gateway";
    public static final String SERVER_VERSION = "1.0.0";
    static final String MAX_SESSIONS_MESSAGE = "Maximum concurrent sessions reached";

    private final BackendRegistry registry;
    private final ServerManager serverManager;
    private final SessionManager sessionManager;
    private final ProtocolAdapter protocolAdapter;
    private final BackendClient backendClient;
    private final McpRequestLogger requestLogger;
    private final GatewayMetrics metrics;
    private final ObjectMapper objectMapper;
    private final Duration proxyTimeout;
    private final Duration fanOutTimeout;
    private final int fanOutConcurrency;

    public McpGateway(BackendRegistry registry,
                      ServerManager serverManager,
                      SessionManager sessionManager,
                      ProtocolAdapter protocolAdapter,
                      BackendClient backendClient,
                      McpRequestLogger requestLogger,
                      GatewayMetrics metrics,
                      ObjectMapper objectMapper,
                      GatewayProperties properties) {
        this.registry = registry;
        this.serverManager = serverManager;
        this.sessionManager = sessionManager;
        this.protocolAdapter = protocolAdapter;
        this.backendClient = backendClient;
        this.requestLogger = requestLogger;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.proxyTimeout = properties.getProxyTimeout();
        this.fanOutTimeout = properties.getFanOutTimeout();
        this.fanOutConcurrency = properties.getFanOutConcurrency();
        metrics.registerGauge("mcp.gateway.sessions.active", sessionManager::getActiveSessionCount);
    }

    public Mono<Void> initialize() {
        log.info("Initializing MCP Gateway...");
        sessionManager.start();
        return serverManager.initialize()
            .doOnSuccess(ignored -> log.info("MCP Gateway initialized successfully"))
            .doOnError(error -> log.error("Failed to initialize MCP Gateway", error));
    }

    public void shutdown() {
        log.info("Shutting down MCP Gateway...");
        serverManager.shutdown();
        sessionManager.shutdown();
        log.info("MCP Gateway shutdown complete");
    }

    /**
     * Handles one HTTP JSON-RPC call. A caller without a valid session token
     * gets a fresh anonymous session while capacity allows; at capacity the
     * call is refused before any parsing or routing.
     */
    public Mono<GatewayHttpResponse> handleHttpRequest(JsonNode body, HttpHeaders headers) {
        Optional<Session> existing = sessionManager.getSessionFromAuthHeader(
            headers.getFirst(HttpHeaders.AUTHORIZATION));

        String issuedToken = null;
        Session session;
        if (existing.isPresent()) {
            session = existing.get();
        } else {
            Optional<Session> created = sessionManager.canCreateNewSession()
                ? sessionManager.createSession(SessionManager.ANONYMOUS_USER, Transport.HTTP)
                : Optional.empty();
            if (created.isEmpty()) {
                return Mono.just(GatewayHttpResponse.of(HttpStatus.SERVICE_UNAVAILABLE,
                    capacityError(protocolAdapter.extractId(body))));
            }
            session = created.get();
            issuedToken = sessionManager.generateToken(session.getId());
        }

        JsonRpcRequest request;
        try {
            request = protocolAdapter.parseHttpRequest(body);
        } catch (JsonRpcException e) {
            log.warn("Rejected invalid JSON-RPC request: {}", e.getData());
            return Mono.just(GatewayHttpResponse.ok(
                JsonRpcResponse.error(protocolAdapter.extractId(body), e.toError()), issuedToken));
        }

        String token = issuedToken;
        return routeAndExecuteRequest(request, session)
            .map(response -> GatewayHttpResponse.ok(response, token));
    }

    /**
     * Opens the session a new socket runs under. A valid token for a live
     * session resumes that session; otherwise a new one is created. Empty
     * when the gateway is at capacity.
     */
    public Optional<Session> openWebSocketSession(String token, WebSocketConnection connection) {
        Optional<Session> session = sessionManager.getSessionFromToken(token);
        if (session.isEmpty()) {
            session = sessionManager.canCreateNewSession()
                ? sessionManager.createSession("websocket-user", Transport.WEBSOCKET)
                : Optional.empty();
        }
        session.ifPresent(s -> sessionManager.attachWebSocket(s.getId(), connection));
        session.ifPresent(s -> log.info("WebSocket {} bound to session {}", connection.getId(), s.getId()));
        return session;
    }

    public Map<String, Object> welcomeMessage(Session session) {
        Map<String, Object> welcome = new LinkedHashMap<>();
        welcome.put("type", "connection");
        welcome.put("sessionId", session.getId());
        welcome.put("sessionToken", sessionManager.generateToken(session.getId()));
        welcome.put("capabilities", getAvailableCapabilities());
        return welcome;
    }

    public JsonRpcResponse capacityError(JsonNode id) {
        return JsonRpcResponse.error(id, JsonRpcError.SERVER_BUSY, MAX_SESSIONS_MESSAGE, null);
    }

    /**
     * Processes one inbound frame. The response is pushed back on the same
     * socket; frames that fail to parse are answered by the adapter. Frames
     * for a session that has already expired are dropped.
     */
    public Mono<Void> handleWebSocketMessage(Session session, WebSocketConnection connection, String message) {
        if (sessionManager.getSession(session.getId()).isEmpty()) {
            log.debug("Dropping frame for expired session {}", session.getId());
            return Mono.empty();
        }
        Optional<JsonRpcRequest> request = protocolAdapter.parseWebSocketMessage(connection, message);
        if (request.isEmpty()) {
            return Mono.empty();
        }
        return routeAndExecuteRequest(request.get(), session)
            .doOnNext(response -> protocolAdapter.sendWebSocketResponse(connection, response))
            .then();
    }

    /**
     * Ends the session a socket ran under, unless another socket has since
     * resumed it.
     */
    public void closeWebSocketSession(Session session, WebSocketConnection connection) {
        if (session.getConnection() != connection) {
            log.debug("WebSocket {} superseded on session {}", connection.getId(), session.getId());
            return;
        }
        log.info("WebSocket connection closed for session: {}", session.getId());
        sessionManager.removeSession(session.getId());
    }

    public Map<String, BackendHealthStatus> getHealthStatus() {
        return serverManager.getHealthStatus();
    }

    /**
     * Routes a parsed request. Never errors: any failure becomes a JSON-RPC
     * error envelope carrying the request id.
     */
    public Mono<JsonRpcResponse> routeAndExecuteRequest(JsonRpcRequest request, Session session) {
        String requestId = requestLogger.newRequestId();
        long startTime = System.currentTimeMillis();
        requestLogger.mcpRequest(request.getMethod(), requestId, session.getId(), request.getId());

        return Mono.defer(() -> {
                Optional<ProtocolMethod> protocolMethod = ProtocolMethod.fromWireName(request.getMethod());
                if (protocolMethod.isPresent()) {
                    return handleProtocolMethod(protocolMethod.get(), request)
                        .doOnNext(response -> logOutcome(request, requestId, session, null, response, startTime));
                }
                return routeToBackend(request, session, requestId, startTime);
            })
            .onErrorResume(error -> {
                long duration = System.currentTimeMillis() - startTime;
                requestLogger.mcpFailure(request.getMethod(), requestId, session.getId(), error, duration);
                return Mono.just(internalError(request.getId(), error));
            });
    }

    private Mono<JsonRpcResponse> routeToBackend(JsonRpcRequest request, Session session,
                                                 String requestId, long startTime) {
        CapabilityMap capabilityMap = registry.getCapabilityMap();
        String capability = protocolAdapter.routingKey(request);
        Optional<String> backendId = protocolAdapter.resolveCapability(request, capabilityMap);

        if (backendId.isEmpty()) {
            JsonRpcResponse notFound = JsonRpcResponse.error(request.getId(), JsonRpcError.METHOD_NOT_FOUND,
                "Method not found", "No server found for capability: " + capability);
            logOutcome(request, requestId, session, null, notFound, startTime);
            return Mono.just(notFound);
        }

        requestLogger.routing(requestId, request.getMethod(), capability, backendId.get());
        BackendInstance instance = serverManager.getServerInstance(backendId.get());
        if (instance == null) {
            JsonRpcResponse unavailable = JsonRpcResponse.error(request.getId(), JsonRpcError.INTERNAL_ERROR,
                "Internal error", "No healthy server instances available for: " + backendId.get());
            logOutcome(request, requestId, session, backendId.get(), unavailable, startTime);
            return Mono.just(unavailable);
        }

        return Mono.using(
                () -> instance,
                checkedOut -> backendClient.call(checkedOut.getDescriptor(), request, proxyTimeout),
                serverManager::releaseServerInstance)
            .onErrorResume(BackendCallException.class, error -> Mono.just(JsonRpcResponse.error(
                request.getId(), JsonRpcError.INTERNAL_ERROR, "Internal error", error.getMessage())))
            .doOnNext(response -> logOutcome(request, requestId, session, backendId.get(), response, startTime));
    }

    private Mono<JsonRpcResponse> handleProtocolMethod(ProtocolMethod method, JsonRpcRequest request) {
        JsonNode id = request.getId();
        switch (method) {
            case INITIALIZE:
                return Mono.just(JsonRpcResponse.success(id, initializeResult()));
            case NOTIFICATIONS_INITIALIZED:
            case PING:
                return Mono.just(JsonRpcResponse.success(id, JsonNodeFactory.instance.objectNode()));
            case TOOLS_LIST:
                return aggregate(method, "tools").map(result -> JsonRpcResponse.success(id, result));
            case RESOURCES_LIST:
                return aggregate(method, "resources").map(result -> JsonRpcResponse.success(id, result));
            case PROMPTS_LIST:
                return aggregate(method, "prompts").map(result -> JsonRpcResponse.success(id, result));
            default:
                return Mono.error(new IllegalStateException("Unhandled protocol method " + method));
        }
    }

    /**
     * Asks every configured backend, healthy or not, for its list and
     * concatenates the answers in configuration order. A backend that fails
     * or times out is logged and left out.
     */
    Mono<ObjectNode> aggregate(ProtocolMethod method, String field) {
        return Flux.fromIterable(registry.getBackends())
            .flatMapSequential(backend -> fetchList(backend, method, field), fanOutConcurrency)
            .collectList()
            .map(lists -> {
                ArrayNode merged = JsonNodeFactory.instance.arrayNode();
                lists.forEach(merged::addAll);
                ObjectNode result = JsonNodeFactory.instance.objectNode();
                result.set(field, merged);
                return result;
            });
    }

    private Mono<ArrayNode> fetchList(BackendDescriptor backend, ProtocolMethod method, String field) {
        JsonRpcRequest listRequest = JsonRpcRequest.builder()
            .id(TextNode.valueOf(field + "_" + System.currentTimeMillis()))
            .method(method.getWireName())
            .params(JsonNodeFactory.instance.objectNode())
            .build();

        return backendClient.call(backend, listRequest, fanOutTimeout)
            .map(response -> {
                JsonNode items = response.getResult() != null ? response.getResult().get(field) : null;
                if (items == null || !items.isArray()) {
                    log.debug("Backend {} returned no {} for {}", backend.getId(), field, method.getWireName());
                    return JsonNodeFactory.instance.arrayNode();
                }
                return (ArrayNode) items;
            })
            .onErrorResume(error -> {
                log.warn("Failed to fetch {} from {}: {}", field, backend.getId(), error.getMessage());
                metrics.recordFanOutFailure(backend.getId(), method.getWireName());
                return Mono.just(JsonNodeFactory.instance.arrayNode());
            });
    }

    /**
     * Sorted, distinct capability names across all backends.
     */
    public List<String> getAvailableCapabilities() {
        return registry.getCapabilityMap().allCapabilities();
    }

    private ObjectNode initializeResult() {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        result.put("protocolVersion", PROTOCOL_VERSION);
        ObjectNode capabilities = result.putObject("capabilities");
        capabilities.putObject("tools");
        capabilities.putObject("resources");
        capabilities.putObject("prompts");
        ObjectNode serverInfo = result.putObject("serverInfo");
        serverInfo.put("name", SERVER_NAME);
        serverInfo.put("version", SERVER_VERSION);
        return result;
    }

    private JsonRpcResponse internalError(JsonNode id, Throwable error) {
        String detail = error.getMessage() != null ? error.getMessage() : "Unknown error";
        return JsonRpcResponse.error(id, JsonRpcError.INTERNAL_ERROR, "Internal error", detail);
    }

    private void logOutcome(JsonRpcRequest request, String requestId, Session session, String backendId,
                            JsonRpcResponse response, long startTime) {
        long duration = System.currentTimeMillis() - startTime;
        if (response.hasError()) {
            requestLogger.mcpError(request.getMethod(), requestId, session.getId(),
                response.getError().getCode(), response.getError().getData(), duration);
        } else {
            requestLogger.mcpResponse(request.getMethod(), requestId, session.getId(), backendId, duration);
        }
    }
}
