package dev.scriptorium.search;

import com.fasterxml.jackson.annotation.JsonProperty;

/** JSON body for the backend's {@code /api/v2/retrieve} endpoint. */
public record RetrieveRequest(
    @JsonProperty("knowledge_base_version") String knowledgeBaseVersion,
    @JsonProperty("query") String query,
    @JsonProperty("retrieval_configuration") RetrievalConfiguration retrievalConfiguration) {

  public record RetrievalConfiguration(
      @JsonProperty("number_of_results") int numberOfResults,
      @JsonProperty("retrieval_type") RetrievalType retrievalType) {}
}
