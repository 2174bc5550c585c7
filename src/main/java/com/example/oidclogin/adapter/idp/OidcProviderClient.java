package com.example.oidclogin.adapter.idp;

import com.example.oidclogin.adapter.idp.dto.DiscoveryDocument;
import com.example.oidclogin.adapter.idp.dto.TokenEndpointResponse;

import java.util.Map;

/**
 * Interface for the identity provider's HTTP endpoints.
 * Handles transport and parsing only, not validation of the flow.
 */
public interface OidcProviderClient {

  /**
   * Fetches {@code {issuer}/.well-known/openid-configuration}.
   *
   * @throws com.example.oidclogin.exception.DiscoveryValidationException if the document
   *     cannot be fetched or parsed
   */
  DiscoveryDocument fetchDiscoveryDocument(String issuerUrl);

  /**
   * POSTs a form-encoded grant request to the token endpoint.
   *
   * @throws com.example.oidclogin.exception.TokenExchangeException on transport failure,
   *     non-success status or malformed JSON
   */
  TokenEndpointResponse requestToken(String tokenEndpoint, Map<String, String> form);
}
