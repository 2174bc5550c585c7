package com.example.oidclogin.service;

import com.example.oidclogin.domain.entity.CacheEntry;
import com.example.oidclogin.domain.entity.OidcClientConfig;
import com.example.oidclogin.domain.entity.TokenSet;
import com.example.oidclogin.exception.CacheException;
import com.example.oidclogin.store.CredentialStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Optional;

/**
 * The single "current login" used by interactive commands.
 * Logging in overwrites it, logging out deletes it. Unlike cache entries it is kept after the
 * access token expires so that its refresh token stays usable.
 */
@Slf4j
@RequiredArgsConstructor
public class ContextService {

  static final String CURRENT_CONTEXT_KEY = "current";

  private final CredentialStore store;
  private final Clock clock;

  /**
   * Stores a fresh login. Returns {@code false} when the context could not be written;
   * the tokens remain usable by the caller.
   */
  public boolean save(OidcClientConfig config, TokenSet tokens) {
    CacheEntry context = new CacheEntry(
        CURRENT_CONTEXT_KEY, config.realm(), config.issuerUrl(), config.clientId(), tokens, clock.instant());
    try {
      store.write(context);
      log.debug("Login context saved for realm {}", config.realm());
      return true;
    } catch (CacheException e) {
      log.warn("Failed to save login context: {}", e.getMessage());
      return false;
    }
  }

  public Optional<CacheEntry> current() {
    try {
      return store.read(CURRENT_CONTEXT_KEY);
    } catch (CacheException e) {
      log.warn("Ignoring unreadable login context: {}", e.getMessage());
      return Optional.empty();
    }
  }

  public boolean isExpired(CacheEntry context) {
    return context.tokens().isExpired(clock);
  }

  /**
   * Replaces the tokens of the current context after a refresh. A failed write is logged and
   * the refreshed context is still returned, since the provider may already have rotated the
   * previous refresh token.
   */
  public CacheEntry replaceTokens(CacheEntry context, TokenSet tokens) {
    CacheEntry updated = context.withTokens(tokens, clock.instant());
    try {
      store.write(updated);
    } catch (CacheException e) {
      log.warn("Failed to persist refreshed login context: {}", e.getMessage());
    }
    return updated;
  }

  public CacheEntry setRealm(CacheEntry context, String realm) {
    CacheEntry updated = context.withRealm(realm);
    store.write(updated);
    return updated;
  }

  /**
   * @return {@code true} if a context existed
   */
  public boolean clear() {
    return store.delete(CURRENT_CONTEXT_KEY);
  }
}
