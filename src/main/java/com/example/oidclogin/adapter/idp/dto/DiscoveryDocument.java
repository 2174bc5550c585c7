package com.example.oidclogin.adapter.idp.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Subset of the OpenID Provider metadata ({@code /.well-known/openid-configuration}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DiscoveryDocument(
    @JsonProperty("issuer")
    String issuer,
    @JsonProperty("authorization_endpoint")
    String authorizationEndpoint,
    @JsonProperty("token_endpoint")
    String tokenEndpoint,
    @JsonProperty("jwks_uri")
    String jwksUri,
    @JsonProperty("end_session_endpoint")
    String endSessionEndpoint
) {}
