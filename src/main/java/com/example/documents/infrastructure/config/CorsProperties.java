package com.example.documents.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * Origins allowed to call the {@code /api/**} endpoints from a browser.
 */
@ConfigurationProperties(prefix = "documents.cors")
public record CorsProperties(
        @DefaultValue("http://localhost:5173") List<String> allowedOrigins
) {
}
