package dev.scriptorium.search;

import java.time.Duration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient}s for the retrieval endpoint and the reranking service.
 *
 * <p>Timeouts are externalized via {@code scriptorium.backend.*} properties; the query path adds
 * no deadline of its own.
 */
@Configuration
public class SearchBackendConfig {

    @Bean
    public RestClient searchRestClient(RestClient.Builder builder, SearchBackendProperties properties) {
        return builder
                .baseUrl(properties.baseUrl())
                .requestFactory(requestFactory(properties.connectTimeoutMs(), properties.readTimeoutMs()))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Bean
    public RestClient rerankRestClient(RestClient.Builder builder, SearchBackendProperties properties) {
        SearchBackendProperties.Rerank rerank = properties.rerank();
        return builder
                .baseUrl(rerank.baseUrl())
                .requestFactory(requestFactory(rerank.connectTimeoutMs(), rerank.readTimeoutMs()))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    private static SimpleClientHttpRequestFactory requestFactory(int connectTimeoutMs, int readTimeoutMs) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofMillis(connectTimeoutMs));
        requestFactory.setReadTimeout(Duration.ofMillis(readTimeoutMs));
        return requestFactory;
    }
}
