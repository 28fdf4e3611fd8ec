package dev.scriptorium.indexing;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * JSON body for {@code POST /api/v1/rags/runs}, the call that starts a new index build.
 *
 * <p>Nested sections (deploy parameters, embedder, options) are free-form maps mirroring the
 * backend's schema.
 */
public record IndexingRunRequest(
    @JsonProperty("project_id") String projectId,
    @JsonProperty("rag_id") String ragId,
    @JsonProperty("product_instance_id") String productInstanceId,
    @JsonProperty("cpu_requested") int cpuRequested,
    @JsonProperty("ram_requested") int ramRequested,
    @JsonProperty("deploy_params") Map<String, Object> deployParams,
    @JsonProperty("embedder") Map<String, Object> embedder,
    @JsonProperty("options") Map<String, Object> options,
    @JsonProperty("description") String description) {

  public IndexingRunRequest {
    deployParams = deployParams == null ? Map.of() : Map.copyOf(deployParams);
    embedder = embedder == null ? Map.of() : Map.copyOf(embedder);
    options = options == null ? Map.of() : Map.copyOf(options);
  }
}
