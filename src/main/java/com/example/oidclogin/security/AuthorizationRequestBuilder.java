package com.example.oidclogin.security;

import com.example.oidclogin.domain.entity.AuthSession;
import okhttp3.HttpUrl;
import org.springframework.stereotype.Component;

/**
 * Builds the browser-facing authorization URL for an {@link AuthSession}.
 */
@Component
public class AuthorizationRequestBuilder {

  static final String RESPONSE_TYPE_CODE = "code";
  static final String CODE_CHALLENGE_METHOD_S256 = "S256";

  public String build(String authorizationEndpoint, AuthSession session) {
    HttpUrl endpoint = HttpUrl.parse(authorizationEndpoint);
    if (endpoint == null) {
      throw new IllegalArgumentException("Invalid authorization endpoint: " + authorizationEndpoint);
    }

    return endpoint.newBuilder()
        .addQueryParameter("client_id", session.clientId())
        .addQueryParameter("response_type", RESPONSE_TYPE_CODE)
        .addQueryParameter("redirect_uri", session.redirectUri())
        .addQueryParameter("scope", String.join(" ", session.scopes()))
        .addQueryParameter("code_challenge", session.codeChallenge())
        .addQueryParameter("code_challenge_method", CODE_CHALLENGE_METHOD_S256)
        .addQueryParameter("state", session.state())
        .build()
        .toString();
  }
}
