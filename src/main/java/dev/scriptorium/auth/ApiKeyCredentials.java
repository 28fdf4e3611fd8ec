package dev.scriptorium.auth;

import org.jspecify.annotations.Nullable;

/**
 * An API key pair that can be exchanged for a bearer token at the IAM endpoint.
 *
 * <p>Sealed so that the only scopes are {@link QueryCredentials} and {@link IndexingCredentials}.
 * The two are separate types on purpose: a component that needs query access cannot be handed an
 * indexing key, and vice versa.
 */
public sealed interface ApiKeyCredentials permits QueryCredentials, IndexingCredentials {

  @Nullable String keyId();

  @Nullable String secret();

  /** Short scope label used in log lines and error messages. */
  String scope();

  default boolean isConfigured() {
    String id = keyId();
    String key = secret();
    return id != null && !id.isBlank() && key != null && !key.isBlank();
  }
}
