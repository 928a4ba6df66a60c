package com.omnimcp.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the MCP gateway.
 * Fronts a fixed set of capability servers behind one JSON-RPC endpoint,
 * reachable over HTTP, WebSocket and SSE.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class OmniMcpGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(OmniMcpGatewayApplication.class, args);
    }
}
