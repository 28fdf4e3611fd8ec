package dev.scriptorium.search;

import java.util.Locale;
import org.jspecify.annotations.Nullable;

/** Retrieval strategy requested from the search backend. */
public enum RetrievalType {
  SEMANTIC,
  KEYWORD,
  HYBRID;

  /**
   * Parses a retrieval type case-insensitively, falling back to {@code defaultType} when absent.
   *
   * @throws InvalidQueryException if the value is present but unknown
   */
  public static RetrievalType parseOrDefault(@Nullable String value, RetrievalType defaultType) {
    if (value == null || value.isBlank()) {
      return defaultType;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new InvalidQueryException(
          "retrieval type must be SEMANTIC, KEYWORD or HYBRID, got: " + value);
    }
  }
}
