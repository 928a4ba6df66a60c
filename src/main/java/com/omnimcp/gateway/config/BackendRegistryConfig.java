package com.omnimcp.gateway.config;

import com.omnimcp.gateway.model.BackendDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the backend registry once from {@code gateway.servers}.
 */
@Configuration
@Slf4j
public class BackendRegistryConfig {

    @Bean
    public BackendRegistry backendRegistry(GatewayProperties properties) {
        List<BackendDescriptor> descriptors = new ArrayList<>();

        for (Map.Entry<String, GatewayProperties.Server> entry : properties.getServers().entrySet()) {
            String backendId = entry.getKey();
            GatewayProperties.Server server = entry.getValue();

            if (!server.isEnabled()) {
                log.info("Backend {} is disabled, skipping", backendId);
                continue;
            }
            if (!StringUtils.hasText(server.getUrl())) {
                log.warn("Backend {} has no URL configured, skipping", backendId);
                continue;
            }

            descriptors.add(toDescriptor(backendId, server));
        }

        BackendRegistry registry = new BackendRegistry(descriptors);
        log.info("Built capability map: {}", registry.getCapabilityMap().asMap());
        return registry;
    }

    static BackendDescriptor toDescriptor(String backendId, GatewayProperties.Server server) {
        return BackendDescriptor.builder()
            .id(backendId)
            .baseUrl(stripTrailingSlash(server.getUrl()))
            .description(server.getDescription())
            .capabilities(server.getTools())
            .capabilities(server.getResources())
            .capabilities(server.getPrompts())
            .healthCheckInterval(server.getHealthCheckInterval())
            .requiresAuth(server.isRequiresAuth())
            .maxRetries(server.getMaxRetries())
            .build();
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
