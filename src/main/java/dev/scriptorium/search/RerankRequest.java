package dev.scriptorium.search;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** JSON body for the reranking endpoint. */
public record RerankRequest(
    String model, String query, List<String> documents, @JsonProperty("top_n") int topN) {

  public RerankRequest {
    documents = documents == null ? List.of() : List.copyOf(documents);
  }
}
