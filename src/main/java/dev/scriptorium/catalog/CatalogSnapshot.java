package dev.scriptorium.catalog;

import java.util.List;

/**
 * Result of one catalog read.
 *
 * @param versions parsed versions ordered by {@code createdAt} ascending
 * @param skippedEntries number of metadata objects that could not be read or parsed
 */
public record CatalogSnapshot(List<IndexVersion> versions, int skippedEntries) {

  public CatalogSnapshot {
    versions = versions == null ? List.of() : List.copyOf(versions);
  }
}
