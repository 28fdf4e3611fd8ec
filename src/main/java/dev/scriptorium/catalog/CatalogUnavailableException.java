package dev.scriptorium.catalog;

/**
 * The catalog listing itself failed (network or authorization). Transient: callers may retry.
 *
 * <p>A single malformed entry never causes this exception; such entries are skipped.
 */
public class CatalogUnavailableException extends RuntimeException {

  public CatalogUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
