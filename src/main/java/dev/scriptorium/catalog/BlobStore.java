package dev.scriptorium.catalog;

import java.util.List;

/**
 * Minimal read access to the object store holding version artifacts.
 *
 * <p>Implementations throw {@link BlobStoreException} on transport or authorization failures.
 */
public interface BlobStore {

  /**
   * Lists every object whose key starts with {@code prefix}.
   *
   * @param prefix key prefix, usually ending with {@code /}
   * @return all matching objects, in the store's listing order
   */
  List<BlobObject> list(String prefix);

  /**
   * Reads the full content of one object.
   *
   * @param key the object key
   * @return the object bytes
   */
  byte[] get(String key);
}
