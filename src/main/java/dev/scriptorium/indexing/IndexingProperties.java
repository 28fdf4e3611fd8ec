package dev.scriptorium.indexing;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for the managed-RAG run API, bound from {@code scriptorium.indexing.*}.
 *
 * <p>Identifiers (project, RAG, product instance, bucket) describe the knowledge base being
 * rebuilt; model and chunking settings are copied into every run payload.
 */
@Validated
@ConfigurationProperties(prefix = "scriptorium.indexing")
public record IndexingProperties(
        @NotBlank String baseUrl,
        @NotBlank String runsPath,
        @NotBlank String projectId,
        @NotBlank String ragId,
        @NotBlank String productInstanceId,
        @NotBlank String s3BucketId,
        @NotBlank String s3Bucket,
        @NotBlank String embedderModel,
        @NotBlank String extractorImage,
        @Positive int chunkSize,
        int chunkOverlap,
        List<String> defaultExtensions,
        int connectTimeoutMs,
        int readTimeoutMs
) {
    public IndexingProperties {
        defaultExtensions = defaultExtensions == null || defaultExtensions.isEmpty()
                ? List.of("txt", "md", "pdf")
                : List.copyOf(defaultExtensions);
    }
}
