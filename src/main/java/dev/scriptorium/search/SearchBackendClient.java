package dev.scriptorium.search;

import dev.scriptorium.auth.IamTokenProvider;
import dev.scriptorium.auth.QueryCredentials;
import dev.scriptorium.auth.TokenExchangeException;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Calls the knowledge base retrieval endpoint for one index version with query-scope credentials.
 *
 * <p>Results are returned in the backend's native relevance order. Every failure, including a
 * failed token exchange, surfaces as an {@link UpstreamException} with stage {@code retrieve}.
 */
@Service
public class SearchBackendClient {

  private static final Logger log = LoggerFactory.getLogger(SearchBackendClient.class);

  static final String STAGE = "retrieve";

  /** Metadata keys tried in order to find a human-readable source for a chunk. */
  static final List<String> SOURCE_KEYS = List.of("source", "file_name", "s3_key", "path");

  private final RestClient restClient;
  private final IamTokenProvider<QueryCredentials> tokenProvider;
  private final SearchBackendProperties properties;

  public SearchBackendClient(
      @Qualifier("searchRestClient") RestClient restClient,
      IamTokenProvider<QueryCredentials> tokenProvider,
      SearchBackendProperties properties) {
    this.restClient = restClient;
    this.tokenProvider = tokenProvider;
    this.properties = properties;
  }

  /**
   * Retrieves up to {@code numberOfResults} passages for {@code query} from {@code versionId}.
   *
   * @param query the trimmed query text
   * @param versionId the index version to search
   * @param numberOfResults candidate count requested from the backend
   * @param retrievalType retrieval strategy
   * @return passages in backend relevance order
   * @throws UpstreamException if the backend or the token exchange fails
   */
  public List<SearchResult> retrieve(
      String query, String versionId, int numberOfResults, RetrievalType retrievalType) {
    String token;
    try {
      token = tokenProvider.token();
    } catch (TokenExchangeException e) {
      throw new UpstreamException(STAGE, e.getMessage(), e);
    }

    RetrieveRequest request =
        new RetrieveRequest(
            versionId,
            query,
            new RetrieveRequest.RetrievalConfiguration(numberOfResults, retrievalType));

    RetrieveResponse response;
    try {
      response =
          restClient
              .post()
              .uri(properties.retrievePath())
              .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
              .body(request)
              .retrieve()
              .body(RetrieveResponse.class);
    } catch (RestClientResponseException e) {
      if (e.getStatusCode().value() == 401) {
        tokenProvider.invalidate();
      }
      throw new UpstreamException(STAGE, "HTTP " + e.getStatusCode().value(), e);
    } catch (RestClientException e) {
      throw new UpstreamException(STAGE, e.getMessage(), e);
    }

    if (response == null) {
      throw new UpstreamException(STAGE, "empty response from search backend");
    }
    log.debug(
        "Retrieved {} chunks from version {} ({} requested)",
        response.results().size(),
        versionId,
        numberOfResults);
    return response.results().stream().map(SearchBackendClient::toSearchResult).toList();
  }

  private static SearchResult toSearchResult(RetrieveResponse.Chunk chunk) {
    return new SearchResult(
        chunk.content() == null ? "" : chunk.content(),
        chunk.score() == null ? 0.0 : chunk.score(),
        sourceReference(chunk.metadata(), chunk.id()));
  }

  static String sourceReference(@Nullable Map<String, Object> metadata, @Nullable String chunkId) {
    if (metadata != null) {
      for (String key : SOURCE_KEYS) {
        Object value = metadata.get(key);
        if (value != null && !value.toString().isBlank()) {
          return value.toString();
        }
      }
    }
    return chunkId == null ? "" : chunkId;
  }
}
