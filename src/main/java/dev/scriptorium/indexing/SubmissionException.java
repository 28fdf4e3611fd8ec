package dev.scriptorium.indexing;

/**
 * Starting an indexing run failed: bad input, rejected credentials or a backend rejection.
 *
 * <p>Permanent unless the input or configuration is corrected.
 */
public class SubmissionException extends RuntimeException {

  public SubmissionException(String message) {
    super(message);
  }

  public SubmissionException(String message, Throwable cause) {
    super(message, cause);
  }
}
