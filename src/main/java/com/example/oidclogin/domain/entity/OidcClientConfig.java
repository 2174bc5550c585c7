package com.example.oidclogin.domain.entity;

import java.time.Duration;
import java.util.List;

/**
 * Immutable settings for one login against one issuer.
 * Every component of the flow receives this object instead of keeping its own defaults.
 */
public record OidcClientConfig(
    String realm,
    String issuerUrl,
    String clientId,
    List<String> scopes,
    int callbackPort,
    String callbackPath,
    Duration timeout,
    boolean validateDiscovery,
    boolean requireIdToken
) {

  private static final String LOOPBACK_HOST = "localhost";

  public String redirectUri() {
    return "http://" + LOOPBACK_HOST + ":" + callbackPort + callbackPath;
  }

  /**
   * Keycloak-style endpoint used when discovery is disabled.
   */
  public String defaultAuthorizationEndpoint() {
    return issuerUrl + "/protocol/openid-connect/auth";
  }

  public String defaultTokenEndpoint() {
    return issuerUrl + "/protocol/openid-connect/token";
  }

  /**
   * Cache key of the interactive identity for this client and issuer.
   */
  public String principalKey() {
    return principalKey(clientId, issuerUrl);
  }

  public static String principalKey(String clientId, String issuerUrl) {
    return clientId + "@" + issuerUrl;
  }

  public OidcClientConfig withCallbackPort(int port) {
    return new OidcClientConfig(realm, issuerUrl, clientId, scopes, port, callbackPath,
                                timeout, validateDiscovery, requireIdToken);
  }

  public OidcClientConfig withTimeout(Duration newTimeout) {
    return new OidcClientConfig(realm, issuerUrl, clientId, scopes, callbackPort, callbackPath,
                                newTimeout, validateDiscovery, requireIdToken);
  }
}
