package dev.scriptorium.version;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of applying a version to the {@link ActiveVersionPointer}.
 *
 * @param previousVersionId the id that was active before, null on first selection
 * @param appliedVersionId the id now active
 */
public record VersionSwitch(@Nullable String previousVersionId, String appliedVersionId) {

  /** True when the pointer already held the applied id. */
  public boolean unchanged() {
    return Objects.equals(previousVersionId, appliedVersionId);
  }
}
