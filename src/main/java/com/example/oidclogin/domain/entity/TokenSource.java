package com.example.oidclogin.domain.entity;

/**
 * Which token of a {@link TokenSet} is handed to the Kubernetes client.
 */
public enum TokenSource {
  // The OIDC ID token, as expected by API servers configured with --oidc-issuer-url.
  ID_TOKEN,
  ACCESS_TOKEN
}
