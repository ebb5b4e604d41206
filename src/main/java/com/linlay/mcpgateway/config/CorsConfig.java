package com.linlay.mcpgateway.config;

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
            @Value("${gateway.cors.path-pattern:/api/**}") String pathPattern,
            @Value("${gateway.cors.allowed-origin-patterns:*}") List<String> allowedOriginPatterns,
            @Value("${gateway.cors.allowed-methods:GET,POST,DELETE,OPTIONS}") List<String> allowedMethods,
            @Value("${gateway.cors.allowed-headers:*}") List<String> allowedHeaders,
            @Value("${gateway.cors.allow-credentials:true}") boolean allowCredentials,
            @Value("${gateway.cors.max-age-seconds:3600}") long maxAgeSeconds
    ) {
        CorsConfiguration configuration = new CorsConfiguration();
        configuration.setAllowedOriginPatterns(compact(allowedOriginPatterns));
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
            if (item != null && !item.isBlank()) {
                output.add(item.trim());
            }
        }
        return output;
    }
}
