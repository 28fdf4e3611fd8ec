package dev.scriptorium.search;

import dev.scriptorium.auth.IamTokenProvider;
import dev.scriptorium.auth.QueryCredentials;
import dev.scriptorium.auth.TokenExchangeException;
import java.util.Comparator;
import java.util.List;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Cross-encoder reranking service that re-scores retrieved candidates with a hosted reranking
 * model (BAAI/bge-reranker-v2-m3 by default).
 *
 * <p>Sends the query and the candidate passages, then returns the candidates sorted by reranking
 * score descending, limited to {@code maxResults}. Only the already-retrieved candidate window is
 * ever sent, never the corpus.
 *
 * <p>Failures are propagated as {@link UpstreamException} with stage {@code rerank}; the decision
 * to fall back belongs to {@link QueryRouter}.
 */
@Service
public class RerankerService {

  static final String STAGE = "rerank";

  private final RestClient restClient;
  private final IamTokenProvider<QueryCredentials> tokenProvider;
  private final SearchBackendProperties properties;

  public RerankerService(
      @Qualifier("rerankRestClient") RestClient restClient,
      IamTokenProvider<QueryCredentials> tokenProvider,
      SearchBackendProperties properties) {
    this.restClient = restClient;
    this.tokenProvider = tokenProvider;
    this.properties = properties;
  }

  /**
   * Reranks search candidates using the hosted reranking model.
   *
   * @param query the original search query text
   * @param candidates retrieved candidates to rerank
   * @param maxResults maximum number of results to return after reranking
   * @return candidates sorted by reranking score descending, limited to maxResults
   * @throws UpstreamException if the reranking call fails or returns an unusable reply
   */
  public List<SearchResult> rerank(String query, List<SearchResult> candidates, int maxResults) {
    if (candidates.isEmpty()) {
      return List.of();
    }

    RerankResponse response;
    try {
      response =
          restClient
              .post()
              .uri(properties.rerank().path())
              .header(HttpHeaders.AUTHORIZATION, "Bearer " + tokenProvider.token())
              .body(
                  new RerankRequest(
                      properties.rerank().model(),
                      query,
                      candidates.stream().map(SearchResult::content).toList(),
                      candidates.size()))
              .retrieve()
              .body(RerankResponse.class);
    } catch (RestClientResponseException e) {
      if (e.getStatusCode().value() == 401) {
        tokenProvider.invalidate();
      }
      throw new UpstreamException(STAGE, "HTTP " + e.getStatusCode().value(), e);
    } catch (RestClientException | TokenExchangeException e) {
      throw new UpstreamException(STAGE, e.getMessage(), e);
    }

    if (response == null || response.results().isEmpty()) {
      throw new UpstreamException(STAGE, "reranker returned no scores");
    }

    return response.results().stream()
        .sorted(Comparator.comparingDouble(RerankResponse.Ranking::relevanceScore).reversed())
        .map(ranking -> toSearchResult(candidates, ranking))
        .limit(maxResults)
        .toList();
  }

  private SearchResult toSearchResult(List<SearchResult> candidates, RerankResponse.Ranking ranking) {
    if (ranking.index() < 0 || ranking.index() >= candidates.size()) {
      throw new UpstreamException(STAGE, "reranker returned out-of-range index " + ranking.index());
    }
    return candidates.get(ranking.index()).withRerankScore(ranking.relevanceScore());
  }
}
