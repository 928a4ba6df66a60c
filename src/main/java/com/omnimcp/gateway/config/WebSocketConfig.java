package com.omnimcp.gateway.config;

import com.omnimcp.gateway.websocket.McpWebSocketHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.server.support.WebSocketHandlerAdapter;

import java.util.Map;

/**
 * WebSocket configuration for the MCP socket endpoint
 */
@Configuration
public class WebSocketConfig {

    public static final String WS_PATH = "/mcp/ws";

    @Bean
    public HandlerMapping mcpWebSocketMapping(McpWebSocketHandler handler) {
        return new SimpleUrlHandlerMapping(Map.of(WS_PATH, handler), Ordered.HIGHEST_PRECEDENCE);
    }

    @Bean
    public WebSocketHandlerAdapter webSocketHandlerAdapter() {
        return new WebSocketHandlerAdapter();
    }
}
