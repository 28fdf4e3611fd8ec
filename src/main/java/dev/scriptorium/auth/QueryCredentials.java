package dev.scriptorium.auth;

import org.jspecify.annotations.Nullable;

/**
 * Read-only credentials used for search and rerank calls.
 *
 * @param keyId the API key id
 * @param secret the API key secret
 */
public record QueryCredentials(@Nullable String keyId, @Nullable String secret)
    implements ApiKeyCredentials {

  @Override
  public String scope() {
    return "query";
  }

  @Override
  public String toString() {
    return "QueryCredentials[keyId=" + keyId + ", secret=***]";
  }
}
