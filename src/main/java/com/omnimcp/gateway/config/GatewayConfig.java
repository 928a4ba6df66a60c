package com.omnimcp.gateway.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsWebFilter;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;
import org.springframework.web.reactive.config.WebFluxConfigurer;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.Arrays;

/**
 * Gateway configuration
 */
@Configuration
public class GatewayConfig {

    /**
     * Configure CORS for the MCP endpoints
     */
    @Bean
    public CorsWebFilter corsFilter(GatewayProperties properties) {
        CorsConfiguration corsConfig = new CorsConfiguration();
        corsConfig.setAllowedOrigins(properties.getCors().getAllowedOrigins());
        corsConfig.setAllowCredentials(properties.getCors().isAllowCredentials());
        corsConfig.setMaxAge(3600L);
        corsConfig.setAllowedMethods(Arrays.asList("GET", "POST", "OPTIONS"));
        corsConfig.setAllowedHeaders(Arrays.asList(
            HttpHeaders.AUTHORIZATION,
            HttpHeaders.CONTENT_TYPE,
            "x-api-key"
        ));
        corsConfig.setExposedHeaders(Arrays.asList(
            "X-Request-ID",
            "Mcp-Session-Token"
        ));

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/**", corsConfig);

        return new CorsWebFilter(source);
    }

    /**
     * WebClient builder for health probes and proxied calls to backends
     */
    @Bean
    public WebClient.Builder webClientBuilder(GatewayProperties properties) {
        int maxInMemorySize = (int) properties.getMaxRequestSize().toBytes();
        return WebClient.builder()
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxInMemorySize));
    }

    /**
     * Caps inbound JSON bodies at {@code gateway.max-request-size}
     */
    @Bean
    public WebFluxConfigurer requestSizeConfigurer(GatewayProperties properties) {
        int maxInMemorySize = (int) properties.getMaxRequestSize().toBytes();
        return new WebFluxConfigurer() {
            @Override
            public void configureHttpMessageCodecs(ServerCodecConfigurer configurer) {
                configurer.defaultCodecs().maxInMemorySize(maxInMemorySize);
            }
        };
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
