package dev.scriptorium.auth;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "scriptorium.iam")
public record IamProperties(
        String baseUrl,
        int connectTimeoutMs,
        int readTimeoutMs,
        long refreshMarginSeconds
) {
}
