package com.example.oidclogin.domain.entity;

/**
 * Confidential client credentials for the client-credentials grant.
 */
public record ServiceAccountCredentials(String clientId, String clientSecret, String source) {

  @Override
  public String toString() {
    return "ServiceAccountCredentials[clientId=" + clientId + ", source=" + source + "]";
  }
}
