package dev.scriptorium.search;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the query path.
 *
 * <p>Properties are bound from {@code scriptorium.search.*} in application.yml.
 *
 * <ul>
 *   <li>{@code default-top-k} - results returned when the caller gives none (default 5, bounded
 *       [1, 50])
 *   <li>{@code rerank-candidates} - candidates retrieved before reranking when the caller gives
 *       none (default 20, bounded [1, 100])
 *   <li>{@code retrieval-type} - SEMANTIC, KEYWORD or HYBRID (default SEMANTIC)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "scriptorium.search")
public class SearchProperties {

  private int defaultTopK = 5;
  private int rerankCandidates = 20;
  private RetrievalType retrievalType = RetrievalType.SEMANTIC;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (defaultTopK < QueryRouter.MIN_TOP_K || defaultTopK > QueryRouter.MAX_TOP_K) {
      throw new IllegalStateException(
          "scriptorium.search.default-top-k must be in [1, 50], got: " + defaultTopK);
    }
    if (rerankCandidates < 1 || rerankCandidates > QueryRouter.MAX_RERANK_CANDIDATES) {
      throw new IllegalStateException(
          "scriptorium.search.rerank-candidates must be in [1, 100], got: " + rerankCandidates);
    }
  }

  public int getDefaultTopK() {
    return defaultTopK;
  }

  public void setDefaultTopK(int defaultTopK) {
    this.defaultTopK = defaultTopK;
  }

  public int getRerankCandidates() {
    return rerankCandidates;
  }

  public void setRerankCandidates(int rerankCandidates) {
    this.rerankCandidates = rerankCandidates;
  }

  public RetrievalType getRetrievalType() {
    return retrievalType;
  }

  public void setRetrievalType(RetrievalType retrievalType) {
    this.retrievalType = retrievalType;
  }
}
