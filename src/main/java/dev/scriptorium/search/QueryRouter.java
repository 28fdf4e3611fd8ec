package dev.scriptorium.search;

import dev.scriptorium.version.ActiveVersionPointer;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Search orchestration layer serving every query from the version named by the {@link
 * ActiveVersionPointer}.
 *
 * <p>Plain search forwards the query to the backend and caps the result at {@code topK}. Advanced
 * search is two-stage: retrieve a wider candidate window ({@code rerankTopK}), rerank only that
 * window, then truncate to {@code topK}. Reranking improves quality but is not required for a
 * correct answer, so a failed rerank falls back to the unranked top {@code topK} candidates.
 *
 * <p>The pointer is read once per call, so both stages of an advanced search hit the same version
 * even if selection runs concurrently. Out-of-range {@code topK} values are clamped, not rejected.
 */
@Service
public class QueryRouter {

  private static final Logger log = LoggerFactory.getLogger(QueryRouter.class);

  static final int MIN_TOP_K = 1;
  static final int MAX_TOP_K = 50;
  static final int MAX_RERANK_CANDIDATES = 100;

  private final ActiveVersionPointer pointer;
  private final SearchBackendClient backendClient;
  private final RerankerService rerankerService;
  private final SearchProperties properties;

  public QueryRouter(
      ActiveVersionPointer pointer,
      SearchBackendClient backendClient,
      RerankerService rerankerService,
      SearchProperties properties) {
    this.pointer = pointer;
    this.backendClient = backendClient;
    this.rerankerService = rerankerService;
    this.properties = properties;
  }

  /** Plain search with the configured retrieval type. */
  public List<SearchResult> search(String query, int topK) {
    return search(query, topK, properties.getRetrievalType());
  }

  /**
   * Retrieves the most relevant passages from the active version.
   *
   * @param query query text, trimmed before use
   * @param topK requested result count, clamped to [1, 50]
   * @param retrievalType retrieval strategy
   * @return passages in backend relevance order, at most {@code topK}
   * @throws InvalidQueryException if the query is blank
   * @throws dev.scriptorium.version.NoActiveVersionException if no version has been selected
   * @throws UpstreamException if the backend call fails
   */
  public List<SearchResult> search(String query, int topK, RetrievalType retrievalType) {
    String trimmed = requireQuery(query);
    String versionId = pointer.require();
    int k = clampTopK(topK);

    List<SearchResult> results = backendClient.retrieve(trimmed, versionId, k, retrievalType);
    return limit(results, k);
  }

  /** Reranked search with the configured retrieval type. */
  public List<SearchResult> searchAdvanced(String query, int topK, int rerankTopK) {
    return searchAdvanced(query, topK, rerankTopK, properties.getRetrievalType());
  }

  /**
   * Retrieves a wider candidate window from the active version and reranks it.
   *
   * @param query query text, trimmed before use
   * @param topK requested result count, clamped to [1, 50]
   * @param rerankTopK candidate window size, clamped to [topK, 100]
   * @param retrievalType retrieval strategy for the first stage
   * @return reranked passages, at most {@code topK}; the unranked top {@code topK} if reranking
   *     fails
   * @throws InvalidQueryException if the query is blank
   * @throws dev.scriptorium.version.NoActiveVersionException if no version has been selected
   * @throws UpstreamException if the retrieval stage fails
   */
  public List<SearchResult> searchAdvanced(
      String query, int topK, int rerankTopK, RetrievalType retrievalType) {
    String trimmed = requireQuery(query);
    String versionId = pointer.require();
    int k = clampTopK(topK);
    int window = clampRerankTopK(rerankTopK, k);

    List<SearchResult> candidates = backendClient.retrieve(trimmed, versionId, window, retrievalType);
    if (candidates.isEmpty()) {
      return List.of();
    }

    try {
      return limit(rerankerService.rerank(trimmed, candidates, k), k);
    } catch (RuntimeException e) {
      log.warn(
          "Reranking failed for version {}, returning unranked results: {}",
          versionId,
          e.getMessage());
      return limit(candidates, k);
    }
  }

  static int clampTopK(int topK) {
    return Math.max(MIN_TOP_K, Math.min(MAX_TOP_K, topK));
  }

  static int clampRerankTopK(int rerankTopK, int topK) {
    return Math.max(topK, Math.min(MAX_RERANK_CANDIDATES, rerankTopK));
  }

  private static String requireQuery(String query) {
    if (query == null || query.isBlank()) {
      throw new InvalidQueryException("Query must not be empty");
    }
    return query.trim();
  }

  private static List<SearchResult> limit(List<SearchResult> results, int k) {
    return results.size() <= k ? results : List.copyOf(results.subList(0, k));
  }
}
