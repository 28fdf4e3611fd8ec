package dev.scriptorium.catalog;

/** Raised by a {@link BlobStore} when the store cannot be reached or refuses the request. */
public class BlobStoreException extends RuntimeException {

  public BlobStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
