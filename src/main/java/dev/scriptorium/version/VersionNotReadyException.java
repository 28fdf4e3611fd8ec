package dev.scriptorium.version;

import dev.scriptorium.catalog.VersionStatus;
import org.jspecify.annotations.Nullable;

/** A specific version was requested for activation but the catalog does not list it as READY. */
public class VersionNotReadyException extends RuntimeException {

  private final String versionId;
  private final @Nullable VersionStatus observedStatus;

  public VersionNotReadyException(String versionId, @Nullable VersionStatus observedStatus) {
    super(
        observedStatus == null
            ? "Version %s is not listed in the catalog".formatted(versionId)
            : "Version %s is %s, only READY versions can be activated"
                .formatted(versionId, observedStatus));
    this.versionId = versionId;
    this.observedStatus = observedStatus;
  }

  public String getVersionId() {
    return versionId;
  }

  /** Status seen in the catalog, or null if the version was not listed at all. */
  public @Nullable VersionStatus getObservedStatus() {
    return observedStatus;
  }
}
