package com.example.oidclogin.service;

import com.example.oidclogin.domain.entity.OidcClientConfig;
import com.example.oidclogin.domain.entity.ProviderEndpoints;
import com.example.oidclogin.domain.entity.TokenSet;
import com.example.oidclogin.exception.TokenExchangeException;
import com.example.oidclogin.properties.ApplicationProperties;
import com.example.oidclogin.store.FileCredentialStore;
import com.example.oidclogin.support.MutableClock;
import com.example.oidclogin.support.TestProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TokenProviderServiceTest {

  @TempDir
  Path tempDir;

  @Mock
  private InteractiveLoginService interactiveLoginService;
  @Mock
  private TokenExchangeService tokenExchangeService;

  private MutableClock clock;
  private TokenCacheService tokenCache;
  private OidcClientConfig config;
  private OidcClientConfig idTokenConfig;
  private TokenProviderService provider;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    ApplicationProperties properties = TestProperties.create("https://idp.example.com", tempDir);
    config = properties.login().toClientConfig();
    idTokenConfig = properties.exec().oidc().toClientConfig();
    tokenCache = new TokenCacheService(
        new FileCredentialStore(tempDir.resolve("cache"), new ObjectMapper()), Duration.ofMinutes(5), clock);
    provider = new TokenProviderService(tokenCache, interactiveLoginService, tokenExchangeService);
  }

  @Test
  void cacheMissRunsLoginOnceAndCachesTheResult() {
    when(interactiveLoginService.login(config)).thenReturn(tokens("at-1", "rt-1", null, 3600));

    TokenSet first = provider.obtainTokens(config);
    TokenSet second = provider.obtainTokens(config);

    assertThat(second).isEqualTo(first);
    verify(interactiveLoginService, times(1)).login(config);
    verifyNoInteractions(tokenExchangeService);
  }

  @Test
  void nearExpiryEntryIsRefreshedAndRecached() {
    tokenCache.save(config.principalKey(), config, tokens("at-1", "rt-1", null, 600));
    clock.advance(Duration.ofMinutes(6));
    when(tokenExchangeService.resolveEndpoints(config)).thenReturn(ProviderEndpoints.defaultsFor(config));
    when(tokenExchangeService.refresh(config.defaultTokenEndpoint(), "itl-cli", "rt-1"))
        .thenReturn(tokens("at-2", "rt-2", null, 3600));

    TokenSet result = provider.obtainTokens(config);

    assertThat(result.accessToken()).isEqualTo("at-2");
    assertThat(tokenCache.get(config.principalKey()))
        .hasValueSatisfying(entry -> assertThat(entry.tokens().refreshToken()).isEqualTo("rt-2"));
    verify(interactiveLoginService, never()).login(any());
  }

  @Test
  void failedRefreshReturnsStillValidCachedTokens() {
    tokenCache.save(config.principalKey(), config, tokens("at-1", "rt-1", null, 600));
    clock.advance(Duration.ofMinutes(6));
    when(tokenExchangeService.resolveEndpoints(config)).thenReturn(ProviderEndpoints.defaultsFor(config));
    when(tokenExchangeService.refresh(config.defaultTokenEndpoint(), "itl-cli", "rt-1"))
        .thenThrow(new TokenExchangeException(config.defaultTokenEndpoint(), 400, "invalid_grant"));

    TokenSet result = provider.obtainTokens(config);

    assertThat(result.accessToken()).isEqualTo("at-1");
    verify(interactiveLoginService, never()).login(any());
  }

  @Test
  void refreshWithoutRequiredIdTokenKeepsCachedTokens() {
    String key = idTokenConfig.principalKey();
    tokenCache.save(key, idTokenConfig, tokens("at-1", "rt-1", "id-1", 600));
    clock.advance(Duration.ofMinutes(6));
    when(tokenExchangeService.resolveEndpoints(idTokenConfig)).thenReturn(ProviderEndpoints.defaultsFor(idTokenConfig));
    when(tokenExchangeService.refresh(idTokenConfig.defaultTokenEndpoint(), "kubernetes-oidc", "rt-1"))
        .thenReturn(tokens("at-2", "rt-2", null, 3600));

    TokenSet result = provider.obtainTokens(idTokenConfig, key);

    assertThat(result.idToken()).isEqualTo("id-1");
    assertThat(tokenCache.get(key))
        .hasValueSatisfying(entry -> assertThat(entry.tokens().accessToken()).isEqualTo("at-1"));
    verify(interactiveLoginService, never()).login(any());
  }

  @Test
  void nearExpiryEntryWithoutRefreshTokenIsReturnedAsIs() {
    tokenCache.save(config.principalKey(), config, tokens("at-1", null, null, 600));
    clock.advance(Duration.ofMinutes(6));

    TokenSet result = provider.obtainTokens(config);

    assertThat(result.accessToken()).isEqualTo("at-1");
    verifyNoInteractions(tokenExchangeService, interactiveLoginService);
  }

  private TokenSet tokens(String accessToken, String refreshToken, String idToken, long lifetimeSeconds) {
    return new TokenSet(accessToken, refreshToken, idToken, "Bearer",
        clock.instant().plusSeconds(lifetimeSeconds), "openid");
  }
}
