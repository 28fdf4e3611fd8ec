package dev.scriptorium.catalog;

import java.time.Instant;

/**
 * One entry of a blob-store listing.
 *
 * @param key full object key
 * @param lastModified last modification time reported by the store
 */
public record BlobObject(String key, Instant lastModified) {
}
