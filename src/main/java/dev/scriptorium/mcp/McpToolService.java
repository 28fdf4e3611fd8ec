package dev.scriptorium.mcp;

import dev.scriptorium.catalog.ArtifactCatalogReader;
import dev.scriptorium.catalog.CatalogSnapshot;
import dev.scriptorium.catalog.CatalogUnavailableException;
import dev.scriptorium.catalog.IndexVersion;
import dev.scriptorium.indexing.DocumentFormat;
import dev.scriptorium.indexing.IndexingJobSubmitter;
import dev.scriptorium.indexing.IndexingRun;
import dev.scriptorium.indexing.SubmissionException;
import dev.scriptorium.search.InvalidQueryException;
import dev.scriptorium.search.QueryRouter;
import dev.scriptorium.search.RetrievalType;
import dev.scriptorium.search.SearchProperties;
import dev.scriptorium.search.SearchResult;
import dev.scriptorium.search.UpstreamException;
import dev.scriptorium.version.ActiveVersionPointer;
import dev.scriptorium.version.NoActiveVersionException;
import dev.scriptorium.version.VersionNotReadyException;
import dev.scriptorium.version.VersionSelector;
import dev.scriptorium.version.VersionSwitch;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing the index lifecycle as tool methods for a calling agent.
 *
 * <p>Each method is annotated with {@code @Tool} and registered via {@link McpToolConfig}. Tool
 * methods follow the structured error pattern: all exceptions are caught and returned as
 * descriptive {@code Error:} strings naming the failed stage, never thrown.
 *
 * <p>Functional tools: {@code start_indexing}, {@code get_versions}, {@code
 * update_active_version}, {@code search}, {@code search_advanced}.
 *
 * @see TokenBudgetTruncator
 */
@Service
public class McpToolService {

  private static final Logger log = LoggerFactory.getLogger(McpToolService.class);

  private final IndexingJobSubmitter indexingJobSubmitter;
  private final ArtifactCatalogReader catalogReader;
  private final VersionSelector versionSelector;
  private final ActiveVersionPointer pointer;
  private final QueryRouter queryRouter;
  private final SearchProperties searchProperties;
  private final TokenBudgetTruncator truncator;

  public McpToolService(
      IndexingJobSubmitter indexingJobSubmitter,
      ArtifactCatalogReader catalogReader,
      VersionSelector versionSelector,
      ActiveVersionPointer pointer,
      QueryRouter queryRouter,
      SearchProperties searchProperties,
      TokenBudgetTruncator truncator) {
    this.indexingJobSubmitter = indexingJobSubmitter;
    this.catalogReader = catalogReader;
    this.versionSelector = versionSelector;
    this.pointer = pointer;
    this.queryRouter = queryRouter;
    this.searchProperties = searchProperties;
    this.truncator = truncator;
  }

  /** Starts a new index build over documents already uploaded to the bucket. */
  @Tool(
      name = "start_indexing",
      description =
          "Start building a new index version from documents in the storage bucket. "
              + "Runs asynchronously for several minutes; poll get_versions until the new version "
              + "is READY, then call update_active_version.")
  public String startIndexing(
      @ToolParam(
              description =
                  "Bucket prefix to index, e.g. 'documents/' or 's3://bucket/documents/'. Empty = whole bucket",
              required = false)
          @Nullable String sourcePrefix,
      @ToolParam(description = "Description of the new version", required = false)
          @Nullable String description,
      @ToolParam(
              description = "Comma-separated file extensions to index (txt, md, pdf). Default: all",
              required = false)
          @Nullable String extensions) {
    try {
      IndexingRun run =
          indexingJobSubmitter.startIndexing(
              sourcePrefix, description, parseCommaSeparated(extensions));
      return ("Indexing started (job ID: %s) for prefix '%s', formats: %s. "
              + "The new version may take a while to appear in get_versions.")
          .formatted(
              run.jobId(),
              run.sourcePrefix(),
              run.formats().stream().map(DocumentFormat::extension).collect(Collectors.joining(", ")));
    } catch (SubmissionException e) {
      log.error("Indexing submission failed: {}", e.getMessage());
      return "Error starting indexing: " + e.getMessage();
    } catch (Exception e) {
      log.error("Unexpected error starting indexing", e);
      return "Error starting indexing: " + e.getMessage();
    }
  }

  /** Lists all index versions known to the catalog with their status. */
  @Tool(
      name = "get_versions",
      description =
          "List all index versions with status (PENDING, RUNNING, READY, FAILED) and creation time. "
              + "Marks the version currently serving search.")
  public String getVersions() {
    try {
      CatalogSnapshot snapshot = catalogReader.readCatalog();
      Optional<String> active = pointer.get();
      if (snapshot.versions().isEmpty()) {
        return ("No index versions found. Active version: %s " + skippedSuffix(snapshot))
            .formatted(active.orElse("none"))
            .trim();
      }

      StringBuilder sb = new StringBuilder();
      sb.append(String.format("Active version: %s%n", active.orElse("none")));
      for (IndexVersion version : snapshot.versions()) {
        sb.append(
            String.format(
                "- %s: %s | created: %s%s%n",
                version.versionId(),
                version.status(),
                version.createdAt(),
                active.filter(version.versionId()::equals).isPresent() ? " (active)" : ""));
      }
      sb.append(skippedSuffix(snapshot));
      return sb.toString();
    } catch (CatalogUnavailableException e) {
      return "Error listing versions (catalog unavailable, retry later): " + e.getMessage();
    } catch (Exception e) {
      return "Error listing versions: " + e.getMessage();
    }
  }

  /**
   * Switches search traffic to a version. Without an id, picks the latest READY version; with an
   * id, activates it only if the catalog lists it as READY.
   */
  @Tool(
      name = "update_active_version",
      description =
          "Switch search to an index version. Omit version_id to use the latest READY version. "
              + "Returns the previous and the newly active version.")
  public String updateActiveVersion(
      @ToolParam(description = "Version ID to activate (must be READY)", required = false)
          @Nullable String versionId) {
    try {
      if (versionId == null || versionId.isBlank()) {
        Optional<VersionSwitch> change = versionSelector.applyLatestReady();
        if (change.isEmpty()) {
          return "No READY index version found yet. Active version unchanged: %s"
              .formatted(pointer.get().orElse("none"));
        }
        return formatSwitch(change.get());
      }
      return formatSwitch(versionSelector.applyIfReady(versionId));
    } catch (VersionNotReadyException e) {
      return "Error: " + e.getMessage();
    } catch (CatalogUnavailableException e) {
      return "Error updating version (catalog unavailable, retry later): " + e.getMessage();
    } catch (Exception e) {
      return "Error updating version: " + e.getMessage();
    }
  }

  /** Semantic search over the active index version. */
  @Tool(
      name = "search",
      description =
          "Search the knowledge base (active index version). "
              + "Returns relevant passages with their source and relevance score.")
  public String search(
      @ToolParam(description = "Search query text") @Nullable String query,
      @ToolParam(description = "Number of results (1-50, default 5)", required = false)
          @Nullable Integer topK,
      @ToolParam(description = "Retrieval type: SEMANTIC, KEYWORD or HYBRID", required = false)
          @Nullable String retrievalType) {
    try {
      RetrievalType type =
          RetrievalType.parseOrDefault(retrievalType, searchProperties.getRetrievalType());
      List<SearchResult> results =
          queryRouter.search(nullToEmpty(query), resolveTopK(topK), type);
      return formatResults(query, results);
    } catch (InvalidQueryException e) {
      return "Error: " + e.getMessage();
    } catch (NoActiveVersionException e) {
      return "Error: " + e.getMessage();
    } catch (UpstreamException e) {
      return "Error searching (stage: %s): %s".formatted(e.getStage(), e.getMessage());
    } catch (Exception e) {
      return "Error searching: " + e.getMessage();
    }
  }

  /** Two-stage search: broad retrieval, then reranking of the candidate window. */
  @Tool(
      name = "search_advanced",
      description =
          "Search the knowledge base with reranking: retrieves rerank_top_k candidates, reranks "
              + "them and returns the best top_k. Falls back to plain ranking if reranking fails.")
  public String searchAdvanced(
      @ToolParam(description = "Search query text") @Nullable String query,
      @ToolParam(description = "Number of results (1-50, default 5)", required = false)
          @Nullable Integer topK,
      @ToolParam(
              description = "Number of candidates to rerank (>= top_k, max 100, default 20)",
              required = false)
          @Nullable Integer rerankTopK,
      @ToolParam(description = "Retrieval type: SEMANTIC, KEYWORD or HYBRID", required = false)
          @Nullable String retrievalType) {
    try {
      RetrievalType type =
          RetrievalType.parseOrDefault(retrievalType, searchProperties.getRetrievalType());
      int candidates = rerankTopK != null ? rerankTopK : searchProperties.getRerankCandidates();
      List<SearchResult> results =
          queryRouter.searchAdvanced(nullToEmpty(query), resolveTopK(topK), candidates, type);
      return formatResults(query, results);
    } catch (InvalidQueryException e) {
      return "Error: " + e.getMessage();
    } catch (NoActiveVersionException e) {
      return "Error: " + e.getMessage();
    } catch (UpstreamException e) {
      return "Error searching (stage: %s): %s".formatted(e.getStage(), e.getMessage());
    } catch (Exception e) {
      return "Error searching: " + e.getMessage();
    }
  }

  private String formatResults(@Nullable String query, List<SearchResult> results) {
    if (results.isEmpty()) {
      return "No results found for query: " + nullToEmpty(query).trim();
    }
    return truncator.truncate(results);
  }

  private static String formatSwitch(VersionSwitch change) {
    if (change.unchanged()) {
      return "Active version unchanged: %s".formatted(change.appliedVersionId());
    }
    return "Active version updated: %s -> %s"
        .formatted(
            change.previousVersionId() != null ? change.previousVersionId() : "none",
            change.appliedVersionId());
  }

  private static String skippedSuffix(CatalogSnapshot snapshot) {
    return snapshot.skippedEntries() > 0
        ? "(%d unreadable catalog entries skipped)".formatted(snapshot.skippedEntries())
        : "";
  }

  private int resolveTopK(@Nullable Integer topK) {
    return topK != null ? topK : searchProperties.getDefaultTopK();
  }

  private static String nullToEmpty(@Nullable String value) {
    return value == null ? "" : value;
  }

  private static @Nullable List<String> parseCommaSeparated(@Nullable String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return Arrays.stream(value.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .toList();
  }
}
