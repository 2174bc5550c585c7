package com.example.oidclogin.domain.entity;

/**
 * Endpoints of an identity provider, either discovered or derived from the issuer URL.
 */
public record ProviderEndpoints(
    String issuer,
    String authorizationEndpoint,
    String tokenEndpoint
) {

  public static ProviderEndpoints defaultsFor(OidcClientConfig config) {
    return new ProviderEndpoints(
        config.issuerUrl(),
        config.defaultAuthorizationEndpoint(),
        config.defaultTokenEndpoint()
    );
  }
}
