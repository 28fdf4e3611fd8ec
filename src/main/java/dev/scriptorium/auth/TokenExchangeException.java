package dev.scriptorium.auth;

/** Raised when credentials are missing or the IAM endpoint refuses to issue a token. */
public class TokenExchangeException extends RuntimeException {

  public TokenExchangeException(String message) {
    super(message);
  }

  public TokenExchangeException(String message, Throwable cause) {
    super(message, cause);
  }
}
