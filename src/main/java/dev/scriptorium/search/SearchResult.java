package dev.scriptorium.search;

import org.jspecify.annotations.Nullable;

/**
 * One retrieved passage.
 *
 * @param content the passage text
 * @param score relevance score assigned by the search backend
 * @param sourceReference the document the passage came from (object key or file name)
 * @param rerankScore the reranking score, null if the passage was not reranked
 */
public record SearchResult(
    String content, double score, String sourceReference, @Nullable Double rerankScore) {

  /** Convenience constructor for results without reranking. */
  public SearchResult(String content, double score, String sourceReference) {
    this(content, score, sourceReference, null);
  }

  public boolean isReranked() {
    return rerankScore != null;
  }

  SearchResult withRerankScore(double newRerankScore) {
    return new SearchResult(content, score, sourceReference, newRerankScore);
  }
}
