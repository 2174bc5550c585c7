package com.example.oidclogin.domain.entity;

/**
 * PKCE verifier and its S256 challenge (RFC 7636).
 */
public record PkcePair(String codeVerifier, String codeChallenge) {

  @Override
  public String toString() {
    return "PkcePair[codeChallenge=" + codeChallenge + "]";
  }
}
