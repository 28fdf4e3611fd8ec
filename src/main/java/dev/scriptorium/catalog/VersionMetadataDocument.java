package dev.scriptorium.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/** JSON shape of a per-version metadata object written by the search backend. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VersionMetadataDocument(
    @JsonProperty("version_id") @Nullable String versionId,
    @JsonProperty("status") @Nullable String status,
    @JsonProperty("created_at") @Nullable String createdAt,
    @JsonProperty("source_prefix") @Nullable String sourcePrefix) {}
