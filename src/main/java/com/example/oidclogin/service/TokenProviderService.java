package com.example.oidclogin.service;

import com.example.oidclogin.domain.entity.CacheEntry;
import com.example.oidclogin.domain.entity.OidcClientConfig;
import com.example.oidclogin.domain.entity.ProviderEndpoints;
import com.example.oidclogin.domain.entity.TokenSet;
import com.example.oidclogin.exception.AuthenticationFlowException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Cache-first access to an interactive identity's tokens.
 *
 * <p>A valid cached set is returned as is. One that is close to expiry is refreshed when it
 * carries a refresh token. Otherwise a full browser login runs and its result is cached under
 * the identity's key, {@link OidcClientConfig#principalKey()} unless the caller names another.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenProviderService {

  private final TokenCacheService tokenCacheService;
  private final InteractiveLoginService interactiveLoginService;
  private final TokenExchangeService tokenExchangeService;

  public TokenSet obtainTokens(OidcClientConfig config) {
    return obtainTokens(config, config.principalKey());
  }

  public TokenSet obtainTokens(OidcClientConfig config, String key) {

    Optional<CacheEntry> cached = tokenCacheService.get(key)
        .filter(entry -> !config.requireIdToken() || entry.tokens().hasIdToken());

    if (cached.isPresent()) {
      CacheEntry entry = cached.get();
      if (!tokenCacheService.isNearExpiry(entry)) {
        log.debug("Using cached tokens for {}", key);
        return entry.tokens();
      }
      Optional<TokenSet> refreshed = tryRefresh(config, key, entry);
      if (refreshed.isPresent()) {
        return refreshed.get();
      }
      log.debug("Cached tokens for {} are close to expiry and cannot be refreshed", key);
      return entry.tokens();
    }

    log.info("No valid cached tokens for {}, starting browser login", key);
    TokenSet tokens = interactiveLoginService.login(config);
    tokenCacheService.save(key, config, tokens);
    return tokens;
  }

  private Optional<TokenSet> tryRefresh(OidcClientConfig config, String key, CacheEntry entry) {
    if (!entry.tokens().hasRefreshToken()) {
      return Optional.empty();
    }
    try {
      ProviderEndpoints endpoints = tokenExchangeService.resolveEndpoints(config);
      TokenSet refreshed = tokenExchangeService.refresh(
          endpoints.tokenEndpoint(), config.clientId(), entry.tokens().refreshToken());
      if (config.requireIdToken() && !refreshed.hasIdToken()) {
        log.debug("Refresh response for {} carried no ID token", key);
        return Optional.empty();
      }
      tokenCacheService.save(key, config, refreshed);
      return Optional.of(refreshed);
    } catch (AuthenticationFlowException e) {
      log.warn("Token refresh for {} failed, keeping cached tokens: {}", key, e.getMessage());
      return Optional.empty();
    }
  }
}
