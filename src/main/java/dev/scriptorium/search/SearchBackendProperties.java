package dev.scriptorium.search;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Endpoints of the search backend and the reranking service.
 *
 * @param baseUrl public URL of the knowledge base
 * @param retrievePath path of the retrieval endpoint
 * @param connectTimeoutMs TCP connection timeout
 * @param readTimeoutMs response read timeout
 * @param rerank reranking service settings
 */
@ConfigurationProperties(prefix = "scriptorium.backend")
public record SearchBackendProperties(
        String baseUrl,
        String retrievePath,
        int connectTimeoutMs,
        int readTimeoutMs,
        Rerank rerank
) {
    public record Rerank(String baseUrl, String path, String model, int connectTimeoutMs, int readTimeoutMs) {}
}
