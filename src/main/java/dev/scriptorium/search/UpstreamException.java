package dev.scriptorium.search;

/**
 * A call to the search backend or the reranker failed.
 *
 * <p>{@link #getStage()} names the failing stage ({@code retrieve} or {@code rerank}) so callers
 * can decide whether to retry.
 */
public class UpstreamException extends RuntimeException {

  private final String stage;

  public UpstreamException(String stage, String message, Throwable cause) {
    super(stage + " failed: " + message, cause);
    this.stage = stage;
  }

  public UpstreamException(String stage, String message) {
    super(stage + " failed: " + message);
    this.stage = stage;
  }

  public String getStage() {
    return stage;
  }
}
