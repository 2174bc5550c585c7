package com.example.oidclogin.domain.entity;

import java.time.Instant;

/**
 * A {@link TokenSet} stored under a principal key, together with the identity it belongs to.
 * The same shape backs both the per-identity token cache and the current login context.
 */
public record CacheEntry(
    String key,
    String realm,
    String issuerUrl,
    String clientId,
    TokenSet tokens,
    Instant cachedAt
) {

  public CacheEntry withRealm(String newRealm) {
    return new CacheEntry(key, newRealm, issuerUrl, clientId, tokens, cachedAt);
  }

  public CacheEntry withTokens(TokenSet newTokens, Instant now) {
    return new CacheEntry(key, realm, issuerUrl, clientId, newTokens, now);
  }
}
