package com.example.oidclogin.domain.entity;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * An immutable set of tokens returned by the identity provider.
 * Superseded, never mutated, when tokens are refreshed.
 */
public record TokenSet(

    String accessToken,

    // Optional, absent for client-credentials grants.
    String refreshToken,

    // Optional, present for OIDC flows requesting the openid scope.
    String idToken,

    String tokenType,

    // The absolute timestamp at which the access token expires.
    Instant expiresAt,

    String scope

) {

  public static final String DEFAULT_TOKEN_TYPE = "Bearer";
  public static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

  public TokenSet {
    if (tokenType == null || tokenType.isBlank()) {
      tokenType = DEFAULT_TOKEN_TYPE;
    }
    if (scope == null) {
      scope = "";
    }
  }

  /**
   * Checks if the token set is expired at the clock's current instant.
   *
   * @return {@code true} unless now is strictly before {@code expiresAt}.
   */
  public boolean isExpired(Clock clock) {
    return !clock.instant().isBefore(expiresAt);
  }

  /**
   * Checks if the token set will expire within the given window.
   * Used by callers that refresh proactively.
   */
  public boolean expiresWithin(Duration window, Clock clock) {
    return !clock.instant().plus(window).isBefore(expiresAt);
  }

  /**
   * Remaining lifetime, or {@code Duration.ZERO} once expired.
   */
  public Duration remainingLifetime(Clock clock) {
    Duration remaining = Duration.between(clock.instant(), expiresAt);
    return remaining.isNegative() ? Duration.ZERO : remaining;
  }

  public boolean hasIdToken() {
    return idToken != null && !idToken.isEmpty();
  }

  public boolean hasRefreshToken() {
    return refreshToken != null && !refreshToken.isEmpty();
  }

  /**
   * Returns a copy that keeps {@code previousRefreshToken} when this set carries none.
   */
  public TokenSet withFallbackRefreshToken(String previousRefreshToken) {
    if (hasRefreshToken()) {
      return this;
    }
    return new TokenSet(accessToken, previousRefreshToken, idToken, tokenType, expiresAt, scope);
  }

  @Override
  public String toString() {
    return "TokenSet[tokenType=" + tokenType + ", expiresAt=" + expiresAt + ", scope=" + scope
        + ", refreshToken=" + (hasRefreshToken() ? "present" : "absent")
        + ", idToken=" + (hasIdToken() ? "present" : "absent") + "]";
  }
}
