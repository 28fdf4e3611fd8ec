package dev.scriptorium.search;

/** The query is empty after trimming or carries an unknown option. */
public class InvalidQueryException extends RuntimeException {

  public InvalidQueryException(String message) {
    super(message);
  }
}
