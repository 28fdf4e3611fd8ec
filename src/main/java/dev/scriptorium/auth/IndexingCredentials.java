package dev.scriptorium.auth;

import org.jspecify.annotations.Nullable;

/**
 * Credentials allowed to trigger index builds. Never used for query traffic.
 *
 * @param keyId the API key id
 * @param secret the API key secret
 */
public record IndexingCredentials(@Nullable String keyId, @Nullable String secret)
    implements ApiKeyCredentials {

  @Override
  public String scope() {
    return "indexing";
  }

  @Override
  public String toString() {
    return "IndexingCredentials[keyId=" + keyId + ", secret=***]";
  }
}
