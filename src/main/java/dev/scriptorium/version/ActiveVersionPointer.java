package dev.scriptorium.version;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Holds the id of the index version that currently serves queries.
 *
 * <p>Backed by a single {@link AtomicReference}: writes are last-write-wins and readers never
 * block each other or see a partial value. No history is kept; rolling back means setting an older
 * id again. The value lives only as long as this object (no persistence across restarts).
 *
 * <p>Only {@link VersionSelector} writes the pointer. Tests create independent instances freely.
 */
@Component
public class ActiveVersionPointer {

  private final AtomicReference<@Nullable String> current = new AtomicReference<>();

  /** Returns the active version id, or empty before the first selection. */
  public Optional<String> get() {
    return Optional.ofNullable(current.get());
  }

  /**
   * Returns the active version id.
   *
   * @throws NoActiveVersionException if no version has been selected
   */
  public String require() {
    String versionId = current.get();
    if (versionId == null) {
      throw new NoActiveVersionException();
    }
    return versionId;
  }

  /**
   * Atomically replaces the active version id.
   *
   * @return the previous id, or null if none was set
   */
  @Nullable String set(String versionId) {
    return current.getAndSet(versionId);
  }
}
