package dev.scriptorium.search;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Reply of the reranking endpoint: one score per input document, addressed by index. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RerankResponse(List<Ranking> results) {

  public RerankResponse {
    results = results == null ? List.of() : List.copyOf(results);
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Ranking(int index, @JsonProperty("relevance_score") double relevanceScore) {}
}
