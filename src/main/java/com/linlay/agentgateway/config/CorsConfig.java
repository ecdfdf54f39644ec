package com.linlay.agentgateway.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsWebFilter;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;

import java.util.ArrayList;
import java.util.List;

@Configuration
public class CorsConfig {

    @Bean
    public CorsWebFilter corsWebFilter(
            @Value("${agent.cors.path-pattern:/chat/**}") String pathPattern,
            @Value("${agent.cors.allowed-origins:http://localhost:5173,http://localhost:3000}") List<String> allowedOrigins,
            @Value("${agent.cors.allowed-methods:GET,POST,PUT,DELETE,OPTIONS}") List<String> allowedMethods,
            @Value("${agent.cors.allowed-headers:Content-Type,Authorization}") List<String> allowedHeaders,
            @Value("${agent.cors.allow-credentials:true}") boolean allowCredentials,
            @Value("${agent.cors.max-age-seconds:3600}") long maxAgeSeconds
    ) {
        CorsConfiguration configuration = new CorsConfiguration();
        configuration.setAllowedOrigins(compact(allowedOrigins));
        configuration.setAllowedMethods(compact(allowedMethods));
        configuration.setAllowedHeaders(compact(allowedHeaders));
        configuration.setAllowCredentials(allowCredentials);
        configuration.setMaxAge(maxAgeSeconds);

        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration(pathPattern, configuration);
        return new CorsWebFilter(source);
    }

    private List<String> compact(List<String> input) {
        List<String> output = new ArrayList<>();
        if (input == null) {
            return output;
        }
        for (String item : input) {
            if (item == null) {
                continue;
            }
            String trimmed = item.trim();
            if (!trimmed.isEmpty()) {
                output.add(trimmed);
            }
        }
        return output;
    }
}
