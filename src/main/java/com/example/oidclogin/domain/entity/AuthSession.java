package com.example.oidclogin.domain.entity;

import java.util.List;

/**
 * State of one in-flight login attempt. Discarded once the flow terminates.
 */
public record AuthSession(
    String codeVerifier,
    String codeChallenge,
    String state,
    String redirectUri,
    String issuerUrl,
    String clientId,
    List<String> scopes
) {

  public static AuthSession start(OidcClientConfig config, PkcePair pkce, String state) {
    return new AuthSession(
        pkce.codeVerifier(),
        pkce.codeChallenge(),
        state,
        config.redirectUri(),
        config.issuerUrl(),
        config.clientId(),
        config.scopes()
    );
  }

  // Keeps the verifier out of log output.
  @Override
  public String toString() {
    return "AuthSession[issuerUrl=" + issuerUrl + ", clientId=" + clientId
        + ", redirectUri=" + redirectUri + "]";
  }
}
