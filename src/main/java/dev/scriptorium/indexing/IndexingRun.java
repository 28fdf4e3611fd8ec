package dev.scriptorium.indexing;

import java.util.List;

/**
 * An accepted indexing run.
 *
 * <p>The job id is what the backend returned. The resulting version may not appear in the catalog
 * until the backend's own write completes, so callers poll the catalog instead of assuming
 * immediate visibility.
 *
 * @param jobId identifier assigned by the backend
 * @param sourcePrefix bucket-relative prefix that was submitted
 * @param description free-text description stored with the version
 * @param formats document formats the run extracts
 */
public record IndexingRun(
    String jobId, String sourcePrefix, String description, List<DocumentFormat> formats) {

  public IndexingRun {
    formats = formats == null ? List.of() : List.copyOf(formats);
  }
}
