package dev.scriptorium.catalog;

import java.time.Instant;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * One build of the semantic index as listed in the artifact catalog.
 *
 * @param versionId opaque identifier assigned by the backend
 * @param status lifecycle status published by the backend
 * @param createdAt creation time, used as the primary ordering key
 * @param sourcePrefix blob-store location the version was built from (informational)
 */
public record IndexVersion(
    String versionId, VersionStatus status, Instant createdAt, @Nullable String sourcePrefix) {

  public IndexVersion {
    Objects.requireNonNull(versionId, "versionId");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(createdAt, "createdAt");
    if (versionId.isBlank()) {
      throw new IllegalArgumentException("versionId must not be blank");
    }
  }

  public boolean isReady() {
    return status == VersionStatus.READY;
  }
}
