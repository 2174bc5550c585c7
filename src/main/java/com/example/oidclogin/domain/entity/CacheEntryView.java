package com.example.oidclogin.domain.entity;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Metadata-only view of a cache entry. Carries no token material.
 */
public record CacheEntryView(
    String key,
    String realm,
    String issuerUrl,
    String clientId,
    String tokenType,
    String scope,
    Instant expiresAt,
    Instant cachedAt,
    boolean hasRefreshToken,
    boolean expired,
    boolean nearExpiry
) {

  public static CacheEntryView of(CacheEntry entry, Duration refreshWindow, Clock clock) {
    TokenSet tokens = entry.tokens();
    return new CacheEntryView(
        entry.key(),
        entry.realm(),
        entry.issuerUrl(),
        entry.clientId(),
        tokens.tokenType(),
        tokens.scope(),
        tokens.expiresAt(),
        entry.cachedAt(),
        tokens.hasRefreshToken(),
        tokens.isExpired(clock),
        tokens.expiresWithin(refreshWindow, clock)
    );
  }
}
