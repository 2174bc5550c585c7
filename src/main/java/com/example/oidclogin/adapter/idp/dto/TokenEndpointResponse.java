package com.example.oidclogin.adapter.idp.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * OAuth2 token endpoint response DTO
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenEndpointResponse(
    @JsonProperty("access_token")
    String accessToken,
    @JsonProperty("token_type")
    String tokenType,
    @JsonProperty("expires_in")
    Long expiresIn,
    @JsonProperty("refresh_token")
    String refreshToken,
    @JsonProperty("id_token")
    String idToken,
    @JsonProperty("scope")
    String scope,
    @JsonProperty("error")
    String error,
    @JsonProperty("error_description")
    String errorDescription
) {

  public boolean hasAccessToken() {
    return accessToken != null && !accessToken.isEmpty();
  }

  public boolean hasIdToken() {
    return idToken != null && !idToken.isEmpty();
  }

  @Override
  public String toString() {
    return "TokenEndpointResponse[tokenType=" + tokenType + ", expiresIn=" + expiresIn
        + ", scope=" + scope + ", error=" + error + "]";
  }
}
