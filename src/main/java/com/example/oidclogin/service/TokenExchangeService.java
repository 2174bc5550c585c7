package com.example.oidclogin.service;

import com.example.oidclogin.adapter.idp.OidcProviderClient;
import com.example.oidclogin.adapter.idp.dto.DiscoveryDocument;
import com.example.oidclogin.adapter.idp.dto.TokenEndpointResponse;
import com.example.oidclogin.domain.entity.AuthSession;
import com.example.oidclogin.domain.entity.OidcClientConfig;
import com.example.oidclogin.domain.entity.ProviderEndpoints;
import com.example.oidclogin.domain.entity.ServiceAccountCredentials;
import com.example.oidclogin.domain.entity.TokenSet;
import com.example.oidclogin.exception.DiscoveryValidationException;
import com.example.oidclogin.exception.TokenExchangeException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns grants into {@link TokenSet}s: authorization code (PKCE), refresh token and
 * client credentials. Optionally validates the issuer's discovery document first.
 *
 * <p>Each exchange is one synchronous request; failures surface immediately.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TokenExchangeService {

  private static final String GRANT_AUTHORIZATION_CODE = "authorization_code";
  private static final String GRANT_REFRESH_TOKEN = "refresh_token";
  private static final String GRANT_CLIENT_CREDENTIALS = "client_credentials";

  private final OidcProviderClient oidcProviderClient;
  private final Clock clock;

  /**
   * Discovered endpoints when discovery validation is enabled, Keycloak-style defaults otherwise.
   */
  public ProviderEndpoints resolveEndpoints(@NonNull OidcClientConfig config) {
    if (!config.validateDiscovery()) {
      return ProviderEndpoints.defaultsFor(config);
    }
    DiscoveryDocument document = validateDiscovery(config.issuerUrl());
    return new ProviderEndpoints(document.issuer(), document.authorizationEndpoint(), document.tokenEndpoint());
  }

  /**
   * Fetches the discovery document and checks the required fields and the issuer.
   *
   * @throws DiscoveryValidationException on a missing field or an issuer that is not exactly
   *     {@code issuerUrl}
   */
  public DiscoveryDocument validateDiscovery(@NonNull String issuerUrl) {
    DiscoveryDocument document = oidcProviderClient.fetchDiscoveryDocument(issuerUrl);
    if (document == null) {
      throw new DiscoveryValidationException("Discovery document for " + issuerUrl + " is empty");
    }

    List<String> missing = new ArrayList<>();
    if (isBlank(document.issuer())) {
      missing.add("issuer");
    }
    if (isBlank(document.authorizationEndpoint())) {
      missing.add("authorization_endpoint");
    }
    if (isBlank(document.tokenEndpoint())) {
      missing.add("token_endpoint");
    }
    if (!missing.isEmpty()) {
      throw new DiscoveryValidationException(
          "Discovery document for " + issuerUrl + " is missing required fields: " + missing);
    }

    if (!issuerUrl.equals(document.issuer())) {
      throw new DiscoveryValidationException(
          "Issuer mismatch: expected " + issuerUrl + ", discovery document declares " + document.issuer());
    }

    log.debug("Discovery document validated for issuer {}", issuerUrl);
    return document;
  }

  public TokenSet exchangeAuthorizationCode(@NonNull ProviderEndpoints endpoints,
                                            @NonNull AuthSession session,
                                            @NonNull String code,
                                            boolean requireIdToken) {
    Map<String, String> form = new LinkedHashMap<>();
    form.put("grant_type", GRANT_AUTHORIZATION_CODE);
    form.put("code", code);
    form.put("redirect_uri", session.redirectUri());
    form.put("client_id", session.clientId());
    form.put("code_verifier", session.codeVerifier());

    TokenSet tokens = toTokenSet(endpoints.tokenEndpoint(),
        oidcProviderClient.requestToken(endpoints.tokenEndpoint(), form), requireIdToken);
    log.info("Authorization code exchanged for tokens at {} (expires {})", endpoints.tokenEndpoint(), tokens.expiresAt());
    return tokens;
  }

  /**
   * Redeems a refresh token. The returned set supersedes the old one and keeps its refresh
   * token when the provider does not rotate it.
   */
  public TokenSet refresh(@NonNull String tokenEndpoint, @NonNull String clientId, @NonNull String refreshToken) {
    Map<String, String> form = new LinkedHashMap<>();
    form.put("grant_type", GRANT_REFRESH_TOKEN);
    form.put("client_id", clientId);
    form.put("refresh_token", refreshToken);

    TokenSet tokens = toTokenSet(tokenEndpoint, oidcProviderClient.requestToken(tokenEndpoint, form), false);
    log.info("Tokens refreshed at {} (expires {})", tokenEndpoint, tokens.expiresAt());
    return tokens.withFallbackRefreshToken(refreshToken);
  }

  public TokenSet clientCredentials(@NonNull String tokenEndpoint, @NonNull ServiceAccountCredentials credentials) {
    Map<String, String> form = new LinkedHashMap<>();
    form.put("grant_type", GRANT_CLIENT_CREDENTIALS);
    form.put("client_id", credentials.clientId());
    form.put("client_secret", credentials.clientSecret());

    TokenSet tokens = toTokenSet(tokenEndpoint, oidcProviderClient.requestToken(tokenEndpoint, form), false);
    log.info("Service account token acquired for client {} (expires {})", credentials.clientId(), tokens.expiresAt());
    return tokens;
  }

  private TokenSet toTokenSet(String tokenEndpoint, TokenEndpointResponse response, boolean requireIdToken) {
    if (response == null) {
      throw new TokenExchangeException(tokenEndpoint, 200, "Token endpoint " + tokenEndpoint + " returned no content");
    }
    if (!response.hasAccessToken()) {
      throw new TokenExchangeException(tokenEndpoint, 200,
          "Token response from " + tokenEndpoint + " is missing access_token");
    }
    if (requireIdToken && !response.hasIdToken()) {
      throw new TokenExchangeException(tokenEndpoint, 200,
          "Token response from " + tokenEndpoint + " is missing id_token");
    }

    long expiresIn = response.expiresIn() != null ? response.expiresIn() : TokenSet.DEFAULT_EXPIRES_IN_SECONDS;
    return new TokenSet(
        response.accessToken(),
        response.refreshToken(),
        response.idToken(),
        response.tokenType(),
        clock.instant().plusSeconds(expiresIn),
        response.scope()
    );
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
