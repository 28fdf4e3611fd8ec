package dev.scriptorium.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * Reply of the IAM token endpoint.
 *
 * @param accessToken the bearer token
 * @param expiresIn lifetime in seconds, absent on some deployments
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IamTokenResponse(
    @JsonProperty("access_token") @Nullable String accessToken,
    @JsonProperty("expires_in") @Nullable Long expiresIn) {}
