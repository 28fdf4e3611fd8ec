package dev.scriptorium.auth;

import java.time.Clock;
import java.time.Duration;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configures the IAM {@link RestClient} and one {@link IamTokenProvider} per credential scope.
 *
 * <p>The providers are distinguished by their generic type, so consumers inject
 * {@code IamTokenProvider<QueryCredentials>} or {@code IamTokenProvider<IndexingCredentials>}
 * and cannot receive the other scope by accident.
 */
@Configuration
public class AuthConfig {

    @Bean
    public RestClient iamRestClient(RestClient.Builder builder, IamProperties properties) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofMillis(properties.connectTimeoutMs()));
        requestFactory.setReadTimeout(Duration.ofMillis(properties.readTimeoutMs()));

        return builder
                .baseUrl(properties.baseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Bean
    public IamTokenProvider<QueryCredentials> queryTokenProvider(
            @Qualifier("iamRestClient") RestClient iamRestClient,
            CredentialsProperties credentials,
            IamProperties properties,
            Clock clock) {
        return new IamTokenProvider<>(iamRestClient, credentials.query(), clock,
                Duration.ofSeconds(properties.refreshMarginSeconds()));
    }

    @Bean
    public IamTokenProvider<IndexingCredentials> indexingTokenProvider(
            @Qualifier("iamRestClient") RestClient iamRestClient,
            CredentialsProperties credentials,
            IamProperties properties,
            Clock clock) {
        return new IamTokenProvider<>(iamRestClient, credentials.indexing(), clock,
                Duration.ofSeconds(properties.refreshMarginSeconds()));
    }
}
