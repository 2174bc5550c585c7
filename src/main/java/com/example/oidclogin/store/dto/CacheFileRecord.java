package com.example.oidclogin.store.dto;

import com.example.oidclogin.domain.entity.CacheEntry;
import com.example.oidclogin.domain.entity.TokenSet;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;

/**
 * On-disk JSON shape of a cache entry. Instants are ISO-8601 strings so the file stays
 * readable with any text editor.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"key", "realm", "issuer_url", "client_id", "token_type", "scope",
    "expires_at", "cached_at", "access_token", "refresh_token", "id_token"})
public record CacheFileRecord(
    @JsonProperty("key")
    String key,
    @JsonProperty("realm")
    String realm,
    @JsonProperty("issuer_url")
    String issuerUrl,
    @JsonProperty("client_id")
    String clientId,
    @JsonProperty("token_type")
    String tokenType,
    @JsonProperty("scope")
    String scope,
    @JsonProperty("expires_at")
    String expiresAt,
    @JsonProperty("cached_at")
    String cachedAt,
    @JsonProperty("access_token")
    String accessToken,
    @JsonProperty("refresh_token")
    String refreshToken,
    @JsonProperty("id_token")
    String idToken
) {

  public static CacheFileRecord from(CacheEntry entry) {
    TokenSet tokens = entry.tokens();
    return new CacheFileRecord(
        entry.key(),
        entry.realm(),
        entry.issuerUrl(),
        entry.clientId(),
        tokens.tokenType(),
        tokens.scope(),
        tokens.expiresAt().toString(),
        entry.cachedAt().toString(),
        tokens.accessToken(),
        tokens.refreshToken(),
        tokens.idToken()
    );
  }

  /**
   * @throws IllegalArgumentException if a required field is missing or malformed
   */
  public CacheEntry toEntry() {
    if (key == null || accessToken == null || expiresAt == null) {
      throw new IllegalArgumentException("Cache record is missing key, access_token or expires_at");
    }
    Instant expiry = Instant.parse(expiresAt);
    Instant cached = cachedAt == null ? expiry : Instant.parse(cachedAt);
    return new CacheEntry(
        key,
        realm,
        issuerUrl,
        clientId,
        new TokenSet(accessToken, refreshToken, idToken, tokenType, expiry, scope),
        cached
    );
  }
}
