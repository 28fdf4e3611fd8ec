package dev.scriptorium.catalog;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Location of the version catalog inside the blob store.
 *
 * @param bucket bucket holding the version artifacts
 * @param prefix key prefix under which each version has its own folder
 * @param metadataFileName name of the per-version metadata object
 * @param deriveFromFolders list a version folder without a metadata object as READY, named after
 *     the folder and dated by its newest object; when false such folders are skipped
 */
@Validated
@ConfigurationProperties(prefix = "scriptorium.catalog")
public record CatalogProperties(
        @NotBlank String bucket,
        @NotBlank String prefix,
        @NotBlank String metadataFileName,
        boolean deriveFromFolders
) {
}
