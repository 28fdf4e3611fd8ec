package dev.scriptorium.indexing;

import com.fasterxml.jackson.databind.JsonNode;
import dev.scriptorium.auth.IamTokenProvider;
import dev.scriptorium.auth.IndexingCredentials;
import dev.scriptorium.auth.TokenExchangeException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Starts index builds on the managed-RAG backend.
 *
 * <p>Authenticates with indexing-scope credentials only, so a leaked query key cannot trigger a
 * rebuild. Submission returns as soon as the backend accepts the run; it never waits for the build
 * to finish and offers no cancellation. Nothing here retries: a rejected run is reported to the
 * caller as a {@link SubmissionException}.
 */
@Service
public class IndexingJobSubmitter {

  private static final Logger log = LoggerFactory.getLogger(IndexingJobSubmitter.class);

  private static final List<String> JOB_ID_FIELDS = List.of("id", "run_id", "version_id");
  private static final String S3_SCHEME = "s3://";

  private final RestClient restClient;
  private final IamTokenProvider<IndexingCredentials> tokenProvider;
  private final IndexingProperties properties;

  public IndexingJobSubmitter(
      @Qualifier("indexingRestClient") RestClient restClient,
      IamTokenProvider<IndexingCredentials> tokenProvider,
      IndexingProperties properties) {
    this.restClient = restClient;
    this.tokenProvider = tokenProvider;
    this.properties = properties;
  }

  /**
   * Starts a build over {@code sourcePrefix} with the default document formats and no description.
   *
   * @param sourcePrefix bucket-relative prefix or {@code s3://bucket/prefix} URI; empty means the
   *     whole bucket
   * @return the accepted run
   * @throws SubmissionException if the input is invalid or the backend refuses the run
   */
  public IndexingRun startIndexing(@Nullable String sourcePrefix) {
    return startIndexing(sourcePrefix, "", null);
  }

  /**
   * Starts a build over {@code sourcePrefix} extracting only the given document formats.
   *
   * @param sourcePrefix bucket-relative prefix or {@code s3://bucket/prefix} URI
   * @param description free-text description stored with the new version
   * @param extensions file extensions to extract; null or empty selects the configured defaults
   * @return the accepted run
   * @throws SubmissionException if the input is invalid or the backend refuses the run
   */
  public IndexingRun startIndexing(
      @Nullable String sourcePrefix, @Nullable String description, @Nullable List<String> extensions) {
    String prefix = normalizePrefix(sourcePrefix);
    List<DocumentFormat> formats = resolveFormats(extensions);
    String runDescription = description == null ? "" : description.trim();

    String token;
    try {
      token = tokenProvider.token();
    } catch (TokenExchangeException e) {
      throw new SubmissionException("Indexing authentication failed: " + e.getMessage(), e);
    }

    log.info(
        "Starting indexing run: rag_id={}, s3_prefix='{}', formats={}",
        properties.ragId(),
        prefix,
        formats);

    ResponseEntity<JsonNode> response;
    try {
      response =
          restClient
              .post()
              .uri(properties.runsPath())
              .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
              .body(buildRequest(prefix, runDescription, formats))
              .retrieve()
              .toEntity(JsonNode.class);
    } catch (RestClientResponseException e) {
      if (e.getStatusCode().value() == 401 || e.getStatusCode().value() == 403) {
        tokenProvider.invalidate();
      }
      log.error(
          "Indexing run rejected: {} - {}", e.getStatusCode().value(), abbreviate(e.getResponseBodyAsString()));
      throw new SubmissionException(
          "Indexing run rejected by backend: HTTP " + e.getStatusCode().value(), e);
    } catch (RestClientException e) {
      throw new SubmissionException("Indexing request failed: " + e.getMessage(), e);
    }

    int status = response.getStatusCode().value();
    if (status != 200 && status != 201 && status != 202) {
      throw new SubmissionException("Indexing run not accepted: HTTP " + status);
    }

    String jobId = extractJobId(response.getBody());
    if (jobId == null) {
      throw new SubmissionException("Backend accepted the indexing run but returned no identifier");
    }

    log.info("Indexing run {} accepted; version becomes visible once the build completes", jobId);
    return new IndexingRun(jobId, prefix, runDescription, formats);
  }

  /** Strips an {@code s3://bucket/} scheme prefix, checking the bucket matches the configured one. */
  String normalizePrefix(@Nullable String sourcePrefix) {
    if (sourcePrefix == null) {
      return "";
    }
    String prefix = sourcePrefix.trim();
    if (!prefix.startsWith(S3_SCHEME)) {
      return prefix;
    }
    String withoutScheme = prefix.substring(S3_SCHEME.length());
    int slash = withoutScheme.indexOf('/');
    String bucket = slash < 0 ? withoutScheme : withoutScheme.substring(0, slash);
    if (!bucket.equals(properties.s3Bucket())) {
      throw new SubmissionException(
          "Source bucket '%s' does not match the indexed bucket '%s'"
              .formatted(bucket, properties.s3Bucket()));
    }
    return slash < 0 ? "" : withoutScheme.substring(slash + 1);
  }

  List<DocumentFormat> resolveFormats(@Nullable List<String> extensions) {
    List<String> requested =
        extensions == null || extensions.stream().allMatch(e -> e == null || e.isBlank())
            ? properties.defaultExtensions()
            : extensions;

    Set<DocumentFormat> formats = new LinkedHashSet<>();
    List<String> unsupported = new ArrayList<>();
    for (String extension : requested) {
      if (extension == null || extension.isBlank()) {
        continue;
      }
      DocumentFormat.fromExtension(extension)
          .ifPresentOrElse(formats::add, () -> unsupported.add(extension.trim()));
    }
    if (!unsupported.isEmpty()) {
      throw new SubmissionException(
          "Unsupported extensions: " + unsupported + ". Supported: txt, md, pdf");
    }
    return List.copyOf(formats);
  }

  IndexingRunRequest buildRequest(String prefix, String description, List<DocumentFormat> formats) {
    Map<String, Object> options =
        Map.of(
            "auth_is_enabled", false,
            "service_account_id", "",
            "logaas_is_enabled", false,
            "logaas_log_group_id", "");
    Map<String, Object> embedderEnv =
        Map.of(
            "EMBEDDER_NAME", properties.embedderModel(),
            "EMBEDDER_MODEL_ID", properties.embedderModel(),
            "EMBEDDER_TYPE", "foundationModels");

    List<Map<String, Object>> extractors =
        formats.stream()
            .map(
                format ->
                    Map.<String, Object>of(
                        "cpu_requested", 1000,
                        "ram_requested", 1024,
                        "replicas", 1,
                        "image", properties.extractorImage(),
                        "extensions_supported", List.of(format.extension()),
                        "extra_envs",
                            format.extractorEnv(properties.chunkSize(), properties.chunkOverlap())))
            .toList();

    Map<String, Object> deployParams =
        Map.of(
            "version", "v0",
            "transformer", Map.of("model", "openai", "extra_envs", embedderEnv),
            "extractors", extractors,
            "options", options,
            "s3_storage",
                Map.of(
                    "s3_bucket_id", properties.s3BucketId(),
                    "s3_bucket", properties.s3Bucket(),
                    "s3_prefix", prefix));

    return new IndexingRunRequest(
        properties.projectId(),
        properties.ragId(),
        properties.productInstanceId(),
        2,
        2,
        deployParams,
        Map.of(
            "name", properties.embedderModel(),
            "model_id", properties.embedderModel(),
            "type", "foundationModels"),
        options,
        description);
  }

  private static @Nullable String extractJobId(@Nullable JsonNode body) {
    if (body == null) {
      return null;
    }
    for (String field : JOB_ID_FIELDS) {
      JsonNode value = body.get(field);
      if (value != null && value.isValueNode() && !value.asText().isBlank()) {
        return value.asText();
      }
    }
    return null;
  }

  private static String abbreviate(String text) {
    return text.length() <= 500 ? text : text.substring(0, 500);
  }
}
