package dev.scriptorium.search;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/** Reply of the backend's {@code /api/v2/retrieve} endpoint. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RetrieveResponse(List<Chunk> results) {

  public RetrieveResponse {
    results = results == null ? List.of() : List.copyOf(results);
  }

  /** A retrieved chunk with free-form metadata. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Chunk(
      @Nullable String id,
      @Nullable String content,
      @Nullable Double score,
      @Nullable Map<String, Object> metadata) {}
}
