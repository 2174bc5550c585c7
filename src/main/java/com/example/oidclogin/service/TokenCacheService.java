package com.example.oidclogin.service;

import com.example.oidclogin.domain.entity.CacheEntry;
import com.example.oidclogin.domain.entity.CacheEntryView;
import com.example.oidclogin.domain.entity.OidcClientConfig;
import com.example.oidclogin.domain.entity.TokenSet;
import com.example.oidclogin.exception.CacheException;
import com.example.oidclogin.store.CredentialStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Per-identity token cache with expiry on read.
 *
 * <p>An entry whose {@code expiresAt} has passed is never returned and is deleted when read.
 * Entries inside the refresh window are still returned; {@link #isNearExpiry(CacheEntry)} lets
 * callers refresh proactively. Write and read failures are logged and swallowed.
 */
@Slf4j
@RequiredArgsConstructor
public class TokenCacheService {

  private final CredentialStore store;
  private final Duration refreshWindow;
  private final Clock clock;

  public void save(String key, OidcClientConfig config, TokenSet tokens) {
    save(new CacheEntry(key, config.realm(), config.issuerUrl(), config.clientId(), tokens, clock.instant()));
  }

  public void save(CacheEntry entry) {
    try {
      store.write(entry);
      log.debug("Cached tokens for {} until {}", entry.key(), entry.tokens().expiresAt());
    } catch (CacheException e) {
      log.warn("Failed to cache tokens for {}: {}", entry.key(), e.getMessage());
    }
  }

  public Optional<CacheEntry> get(String key) {
    Optional<CacheEntry> entry;
    try {
      entry = store.read(key);
    } catch (CacheException e) {
      log.warn("Ignoring unreadable cache entry for {}: {}", key, e.getMessage());
      return Optional.empty();
    }

    if (entry.isPresent() && entry.get().tokens().isExpired(clock)) {
      log.debug("Evicting expired cache entry for {}", key);
      evict(key);
      return Optional.empty();
    }
    return entry;
  }

  public boolean isNearExpiry(CacheEntry entry) {
    return entry.tokens().expiresWithin(refreshWindow, clock);
  }

  public List<CacheEntryView> list() {
    return store.list().stream()
        .map(entry -> CacheEntryView.of(entry, refreshWindow, clock))
        .sorted(Comparator.comparing(CacheEntryView::key))
        .toList();
  }

  public boolean delete(String key) {
    return store.delete(key);
  }

  public void clear() {
    store.clear();
  }

  private void evict(String key) {
    try {
      store.delete(key);
    } catch (CacheException e) {
      log.warn("Failed to evict expired cache entry for {}: {}", key, e.getMessage());
    }
  }
}
