package com.example.oidclogin.service;

import com.example.oidclogin.domain.entity.CacheEntry;
import com.example.oidclogin.domain.entity.IdentitySummary;
import com.example.oidclogin.domain.entity.OidcClientConfig;
import com.example.oidclogin.domain.entity.ProviderEndpoints;
import com.example.oidclogin.domain.entity.TokenSet;
import com.example.oidclogin.exception.AuthenticationFlowException;
import com.example.oidclogin.properties.ApplicationProperties;
import com.example.oidclogin.util.JwtClaimsReader;
import com.nimbusds.jwt.JWTClaimsSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.text.ParseException;
import java.util.Optional;

/**
 * Operations on the current login context: login, refresh, logout, realm switch and whoami.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoginSessionService {

  private final ApplicationProperties properties;
  private final InteractiveLoginService interactiveLoginService;
  private final TokenExchangeService tokenExchangeService;
  private final TokenCacheService tokenCacheService;
  private final ContextService contextService;

  /**
   * Runs a browser login and makes it the current context.
   *
   * @param realm realm to log in to, or {@code null} for the configured one
   */
  public CacheEntry login(String realm) {
    OidcClientConfig config = properties.login().toClientConfig(realm);
    TokenSet tokens = interactiveLoginService.login(config);

    tokenCacheService.save(config.principalKey(), config, tokens);
    contextService.save(config, tokens);
    log.info("Logged in to realm {} as client {}", config.realm(), config.clientId());

    return contextService.current().orElseGet(() -> new CacheEntry(
        ContextService.CURRENT_CONTEXT_KEY, config.realm(), config.issuerUrl(), config.clientId(), tokens, null));
  }

  public CacheEntry refresh() {
    CacheEntry context = requireContext();
    if (!context.tokens().hasRefreshToken()) {
      throw new AuthenticationFlowException("The current login has no refresh token; log in again");
    }

    OidcClientConfig config = properties.login().toClientConfig(context.realm());
    ProviderEndpoints endpoints = tokenExchangeService.resolveEndpoints(config);
    TokenSet refreshed = tokenExchangeService.refresh(
        endpoints.tokenEndpoint(), context.clientId(), context.tokens().refreshToken());

    tokenCacheService.save(config.principalKey(), config, refreshed);
    return contextService.replaceTokens(context, refreshed);
  }

  /**
   * Forgets the current login and its cached tokens.
   *
   * @return {@code false} if there was nothing to log out of
   */
  public boolean logout() {
    Optional<CacheEntry> context = contextService.current();
    context.ifPresent(entry -> tokenCacheService.delete(OidcClientConfig.principalKey(entry.clientId(), entry.issuerUrl())));
    return contextService.clear() || context.isPresent();
  }

  public Optional<CacheEntry> current() {
    return contextService.current();
  }

  public CacheEntry setRealm(String realm) {
    if (realm == null || realm.isBlank() || realm.contains("/")) {
      throw new IllegalArgumentException("Invalid realm name: " + realm);
    }
    CacheEntry updated = contextService.setRealm(requireContext(), realm);
    log.info("Current realm set to {}", realm);
    return updated;
  }

  public IdentitySummary whoami() {
    CacheEntry context = requireContext();
    TokenSet tokens = context.tokens();
    String token = tokens.hasIdToken() ? tokens.idToken() : tokens.accessToken();

    JWTClaimsSet claims = JwtClaimsReader.readUnverifiedClaims(token)
        .orElseThrow(() -> new AuthenticationFlowException("The current login does not carry a readable JWT"));

    return new IdentitySummary(
        stringClaim(claims, "preferred_username"),
        stringClaim(claims, "email"),
        stringClaim(claims, "name"),
        claims.getSubject(),
        claims.getIssuer() != null ? claims.getIssuer() : context.issuerUrl(),
        context.realm(),
        tokens.expiresAt(),
        contextService.isExpired(context)
    );
  }

  private CacheEntry requireContext() {
    return contextService.current()
        .orElseThrow(() -> new AuthenticationFlowException("Not logged in; run 'login' first"));
  }

  private static String stringClaim(JWTClaimsSet claims, String name) {
    try {
      return claims.getStringClaim(name);
    } catch (ParseException e) {
      return null;
    }
  }
}
