package dev.scriptorium.version;

/** No version has been selected yet; run version selection before querying. */
public class NoActiveVersionException extends RuntimeException {

  public NoActiveVersionException() {
    super("No active index version. Select a READY version with update_active_version first.");
  }
}
