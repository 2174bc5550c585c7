package com.example.oidclogin.service;

import com.example.oidclogin.domain.entity.CacheEntry;
import com.example.oidclogin.domain.entity.CacheEntryView;
import com.example.oidclogin.domain.entity.OidcClientConfig;
import com.example.oidclogin.domain.entity.TokenSet;
import com.example.oidclogin.exception.CacheException;
import com.example.oidclogin.store.CredentialStore;
import com.example.oidclogin.store.FileCredentialStore;
import com.example.oidclogin.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TokenCacheServiceTest {

  private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");
  private static final OidcClientConfig CONFIG = new OidcClientConfig("test", "https://idp/realms/test", "itl-cli",
      List.of("openid"), 8765, "/callback", Duration.ofMinutes(1), true, false);

  @TempDir
  Path tempDir;

  private MutableClock clock;
  private FileCredentialStore store;
  private TokenCacheService cache;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    store = new FileCredentialStore(tempDir, new ObjectMapper());
    cache = new TokenCacheService(store, Duration.ofMinutes(5), clock);
  }

  @Test
  void returnsSavedTokensWhileValid() {
    TokenSet tokens = tokensExpiringIn(Duration.ofSeconds(3600));

    cache.save(CONFIG.principalKey(), CONFIG, tokens);

    assertThat(cache.get(CONFIG.principalKey()))
        .hasValueSatisfying(entry -> {
          assertThat(entry.tokens()).isEqualTo(tokens);
          assertThat(entry.cachedAt()).isEqualTo(START);
          assertThat(entry.clientId()).isEqualTo("itl-cli");
        });
  }

  @Test
  void evictsEntryOnceExpired() {
    cache.save(CONFIG.principalKey(), CONFIG, tokensExpiringIn(Duration.ofSeconds(3600)));

    clock.advance(Duration.ofSeconds(3600));

    assertThat(cache.get(CONFIG.principalKey())).isEmpty();
    assertThat(store.read(CONFIG.principalKey())).isEmpty();
  }

  @Test
  void nearExpiryEntryIsStillReturnedButFlagged() {
    cache.save(CONFIG.principalKey(), CONFIG, tokensExpiringIn(Duration.ofMinutes(10)));
    clock.advance(Duration.ofMinutes(6));

    CacheEntry entry = cache.get(CONFIG.principalKey()).orElseThrow();

    assertThat(cache.isNearExpiry(entry)).isTrue();
  }

  @Test
  void listShowsMetadataWithoutTokens() {
    cache.save("b-key", CONFIG, tokensExpiringIn(Duration.ofMinutes(2)));
    cache.save("a-key", CONFIG, tokensExpiringIn(Duration.ofHours(1)));

    List<CacheEntryView> views = cache.list();

    assertThat(views).extracting(CacheEntryView::key).containsExactly("a-key", "b-key");
    assertThat(views.get(0).nearExpiry()).isFalse();
    assertThat(views.get(1).nearExpiry()).isTrue();
    assertThat(views.get(1).toString()).doesNotContain("access-token");
  }

  @Test
  void writeFailureIsNotPropagated() {
    CredentialStore failing = mock(CredentialStore.class);
    doThrow(new CacheException("disk full")).when(failing).write(any());
    TokenCacheService failingCache = new TokenCacheService(failing, Duration.ofMinutes(5), clock);

    assertThatCode(() -> failingCache.save("key", CONFIG, tokensExpiringIn(Duration.ofHours(1))))
        .doesNotThrowAnyException();
  }

  @Test
  void readFailureIsTreatedAsCacheMiss() {
    CredentialStore failing = mock(CredentialStore.class);
    when(failing.read("key")).thenThrow(new CacheException("corrupt"));
    TokenCacheService failingCache = new TokenCacheService(failing, Duration.ofMinutes(5), clock);

    assertThat(failingCache.get("key")).isEmpty();
  }

  private TokenSet tokensExpiringIn(Duration lifetime) {
    return new TokenSet("access-token", "refresh-token", "id-token", "Bearer", clock.instant().plus(lifetime), "openid");
  }
}
