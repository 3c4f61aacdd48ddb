package com.narraflow.narraflow_backend.config;

import com.narraflow.narraflow_backend.controller.FlowNodeController;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;
import org.springframework.web.filter.CorsFilter;

import java.util.Arrays;
import java.util.List;

/**
 * Browser access for the flow editor. The same origin list guards the REST API here and the
 * STOMP handshake in {@link WebSocketConfig}.
 */
@Configuration
public class CorsConfig {

    private static final List<String> EDITOR_METHODS = List.of("GET", "POST", "PUT", "DELETE", "OPTIONS");

    @Value("${narraflow.cors.allowed-origins:http://localhost:3000}")
    private String allowedOrigins;

    @Value("${narraflow.cors.max-age-seconds:3600}")
    private long maxAgeSeconds;

    @Bean
    public CorsFilter corsFilter() {
        CorsConfiguration editor = new CorsConfiguration();
        editor.setAllowedOriginPatterns(originPatterns(allowedOrigins));
        editor.setAllowedMethods(EDITOR_METHODS);
        editor.setAllowedHeaders(List.of(HttpHeaders.CONTENT_TYPE, HttpHeaders.AUTHORIZATION,
                FlowNodeController.SESSION_HEADER));
        editor.setExposedHeaders(List.of(FlowNodeController.SESSION_HEADER));
        editor.setAllowCredentials(true);
        editor.setMaxAge(maxAgeSeconds);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/api/**", editor);
        return new CorsFilter(source);
    }

    /** Comma-separated origins as configured; blanks are skipped. */
    static List<String> originPatterns(String configured) {
        return Arrays.stream(configured.split(","))
                .map(String::trim)
                .filter(origin -> !origin.isEmpty())
                .toList();
    }
}
