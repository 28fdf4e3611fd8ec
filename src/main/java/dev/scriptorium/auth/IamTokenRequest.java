package dev.scriptorium.auth;

/** JSON body for the IAM {@code /api/v1/auth/token} endpoint. */
public record IamTokenRequest(String keyId, String secret) {

  @Override
  public String toString() {
    return "IamTokenRequest[keyId=" + keyId + ", secret=***]";
  }
}
