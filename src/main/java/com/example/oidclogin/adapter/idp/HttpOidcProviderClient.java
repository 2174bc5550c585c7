package com.example.oidclogin.adapter.idp;

import com.example.oidclogin.adapter.idp.dto.DiscoveryDocument;
import com.example.oidclogin.adapter.idp.dto.TokenEndpointResponse;
import com.example.oidclogin.exception.DiscoveryValidationException;
import com.example.oidclogin.exception.TokenExchangeException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;

/**
 * OkHttp-based client for discovery and token endpoints.
 * Every call is a single synchronous request; nothing is retried.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpOidcProviderClient implements OidcProviderClient {

  static final String DISCOVERY_PATH = "/.well-known/openid-configuration";

  private final OkHttpClient identityProviderHttpClient;
  private final ObjectMapper objectMapper;

  @Override
  public DiscoveryDocument fetchDiscoveryDocument(String issuerUrl) {
    String discoveryUrl = discoveryUrl(issuerUrl);
    log.debug("Fetching OIDC discovery document from {}", discoveryUrl);

    Request request = new Request.Builder()
        .url(discoveryUrl)
        .header("Accept", "application/json")
        .get()
        .build();

    try (Response response = identityProviderHttpClient.newCall(request).execute()) {
      if (!response.isSuccessful()) {
        throw new DiscoveryValidationException(
            "Discovery document request to " + discoveryUrl + " failed with status " + response.code());
      }
      ResponseBody body = response.body();
      if (body == null) {
        throw new DiscoveryValidationException("Empty discovery document from " + discoveryUrl);
      }
      return objectMapper.readValue(body.string(), DiscoveryDocument.class);

    } catch (JsonProcessingException e) {
      throw new DiscoveryValidationException("Invalid JSON in discovery document from " + discoveryUrl, e);
    } catch (IOException e) {
      throw new DiscoveryValidationException("Failed to fetch discovery document from " + discoveryUrl, e);
    }
  }

  @Override
  public TokenEndpointResponse requestToken(String tokenEndpoint, Map<String, String> form) {
    log.debug("Requesting tokens from {} with grant_type={}", tokenEndpoint, form.get("grant_type"));

    FormBody.Builder formBody = new FormBody.Builder();
    form.forEach(formBody::add);

    Request request = new Request.Builder()
        .url(tokenEndpoint)
        .header("Accept", "application/json")
        .post(formBody.build())
        .build();

    try (Response response = identityProviderHttpClient.newCall(request).execute()) {
      ResponseBody body = response.body();
      String payload = body == null ? "" : body.string();

      if (!response.isSuccessful()) {
        throw new TokenExchangeException(tokenEndpoint, response.code(),
            "Token request to " + tokenEndpoint + " failed with status " + response.code()
                + describeOAuthError(payload));
      }
      if (payload.isBlank()) {
        throw new TokenExchangeException(tokenEndpoint, response.code(),
            "Token endpoint " + tokenEndpoint + " returned an empty body");
      }
      return parseTokenResponse(tokenEndpoint, response.code(), payload);

    } catch (IOException e) {
      throw new TokenExchangeException(tokenEndpoint,
          "Token request to " + tokenEndpoint + " failed due to network error", e);
    }
  }

  static String discoveryUrl(String issuerUrl) {
    String base = issuerUrl.endsWith("/") ? issuerUrl.substring(0, issuerUrl.length() - 1) : issuerUrl;
    return base + DISCOVERY_PATH;
  }

  private TokenEndpointResponse parseTokenResponse(String tokenEndpoint, int status, String payload) {
    try {
      return objectMapper.readValue(payload, TokenEndpointResponse.class);
    } catch (JsonProcessingException e) {
      // The payload may hold tokens, so only the parser location is kept.
      throw new TokenExchangeException(tokenEndpoint, status,
          "Token endpoint " + tokenEndpoint + " returned malformed JSON at "
              + (e.getLocation() == null ? "unknown position" : e.getLocation().offsetDescription()));
    }
  }

  /**
   * Extracts the OAuth {@code error} and {@code error_description} of a failed response, if any.
   */
  private String describeOAuthError(String payload) {
    if (payload == null || payload.isBlank()) {
      return "";
    }
    try {
      JsonNode node = objectMapper.readTree(payload);
      JsonNode error = node.get("error");
      if (error == null || !error.isTextual()) {
        return "";
      }
      JsonNode description = node.get("error_description");
      return description != null && description.isTextual()
          ? " (" + error.asText() + ": " + description.asText() + ")"
          : " (" + error.asText() + ")";
    } catch (JsonProcessingException e) {
      return "";
    }
  }
}
