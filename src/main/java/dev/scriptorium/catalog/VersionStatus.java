package dev.scriptorium.catalog;

import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * Lifecycle states of an {@link IndexVersion}, as reported by the search backend.
 *
 * <p>Normal flow: {@code PENDING → RUNNING → READY}. A build may end in {@code FAILED} instead.
 * This application never writes a status; it only reads what the backend published.
 */
public enum VersionStatus {
  /** Submitted, not yet picked up by the backend. */
  PENDING,
  /** Build in progress. */
  RUNNING,
  /** Build finished; the version can serve queries. */
  READY,
  /** Build finished without a usable index. */
  FAILED;

  public boolean isTerminal() {
    return this == READY || this == FAILED;
  }

  /**
   * Parses a status label case-insensitively.
   *
   * @param value raw status from a metadata document
   * @return the matching status
   * @throws IllegalArgumentException if the value is null, blank or unknown
   */
  public static VersionStatus parse(@Nullable String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Version status is missing");
    }
    return VersionStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
