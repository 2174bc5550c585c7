package com.example.oidclogin.service;

import com.example.oidclogin.domain.entity.CacheEntry;
import com.example.oidclogin.domain.entity.OidcClientConfig;
import com.example.oidclogin.domain.entity.ProviderEndpoints;
import com.example.oidclogin.domain.entity.ServiceAccountCredentials;
import com.example.oidclogin.domain.entity.TokenSet;
import com.example.oidclogin.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * Client-credentials tokens for service accounts, cached under the client id. A cached token
 * is only reused for the issuer that granted it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ServiceAccountTokenService {

  private final ApplicationProperties properties;
  private final TokenExchangeService tokenExchangeService;
  private final TokenCacheService tokenCacheService;
  private final Clock clock;

  public TokenSet getToken(ServiceAccountCredentials credentials, String realm, boolean useCache) {
    String key = credentials.clientId();
    OidcClientConfig config = properties.login().toClientConfig(realm);
    if (useCache) {
      Optional<CacheEntry> cached = tokenCacheService.get(key)
          .filter(entry -> config.issuerUrl().equals(entry.issuerUrl()))
          .filter(entry -> !tokenCacheService.isNearExpiry(entry));
      if (cached.isPresent()) {
        log.debug("Using cached service account token for {}", key);
        return cached.get().tokens();
      }
    }

    ProviderEndpoints endpoints = tokenExchangeService.resolveEndpoints(config);
    log.debug("Requesting service account token for {} from {}", key, endpoints.tokenEndpoint());
    TokenSet tokens = tokenExchangeService.clientCredentials(endpoints.tokenEndpoint(), credentials);

    tokenCacheService.save(new CacheEntry(
        key, config.realm(), config.issuerUrl(), credentials.clientId(), tokens, clock.instant()));
    return tokens;
  }
}
