package dev.scriptorium.auth;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Both credential scopes, bound from {@code scriptorium.credentials.query.*} and {@code
 * scriptorium.credentials.indexing.*}.
 */
@ConfigurationProperties(prefix = "scriptorium.credentials")
public record CredentialsProperties(QueryCredentials query, IndexingCredentials indexing) {

  public CredentialsProperties {
    query = query == null ? new QueryCredentials(null, null) : query;
    indexing = indexing == null ? new IndexingCredentials(null, null) : indexing;
  }
}
