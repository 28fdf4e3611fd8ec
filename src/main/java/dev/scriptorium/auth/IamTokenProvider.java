package dev.scriptorium.auth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Exchanges one scope's API key for a bearer token and caches it until shortly before expiry.
 *
 * <p>One instance exists per credential scope, typed by that scope, so the query-time and
 * indexing-time caches never share a token. A cached token is reused while more than {@code
 * refreshMargin} of its lifetime remains.
 *
 * @param <C> the credential scope this provider serves
 */
public class IamTokenProvider<C extends ApiKeyCredentials> {

  private static final Logger log = LoggerFactory.getLogger(IamTokenProvider.class);

  static final String TOKEN_PATH = "/api/v1/auth/token";
  static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

  private final RestClient restClient;
  private final C credentials;
  private final Clock clock;
  private final Duration refreshMargin;

  private @Nullable String cachedToken;
  private Instant expiresAt = Instant.EPOCH;

  public IamTokenProvider(RestClient restClient, C credentials, Clock clock, Duration refreshMargin) {
    this.restClient = restClient;
    this.credentials = credentials;
    this.clock = clock;
    this.refreshMargin = refreshMargin;
  }

  /**
   * Returns a valid bearer token, fetching a new one when the cache is empty or about to expire.
   *
   * @return the bearer token (without the {@code Bearer} prefix)
   * @throws TokenExchangeException if credentials are not configured or the exchange fails
   */
  public synchronized String token() {
    Instant now = clock.instant();
    if (cachedToken != null && expiresAt.isAfter(now.plus(refreshMargin))) {
      return cachedToken;
    }
    if (!credentials.isConfigured()) {
      throw new TokenExchangeException(
          "IAM credentials for the " + credentials.scope() + " scope are not configured");
    }

    log.info("Requesting IAM token for {} scope", credentials.scope());
    IamTokenResponse response;
    try {
      response =
          restClient
              .post()
              .uri(TOKEN_PATH)
              .body(new IamTokenRequest(credentials.keyId(), credentials.secret()))
              .retrieve()
              .body(IamTokenResponse.class);
    } catch (RestClientException e) {
      throw new TokenExchangeException(
          "IAM token exchange failed for " + credentials.scope() + " scope: " + e.getMessage(), e);
    }

    if (response == null || response.accessToken() == null || response.accessToken().isBlank()) {
      throw new TokenExchangeException(
          "IAM endpoint returned no access token for " + credentials.scope() + " scope");
    }

    long lifetime =
        response.expiresIn() != null ? response.expiresIn() : DEFAULT_EXPIRES_IN_SECONDS;
    cachedToken = response.accessToken();
    expiresAt = now.plusSeconds(lifetime);
    log.info("IAM token for {} scope valid for {}s", credentials.scope(), lifetime);
    return cachedToken;
  }

  /** Drops the cached token so the next call fetches a fresh one. */
  public synchronized void invalidate() {
    cachedToken = null;
    expiresAt = Instant.EPOCH;
  }

  public C credentials() {
    return credentials;
  }
}
