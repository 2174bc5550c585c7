package com.example.oidclogin.properties;

import com.example.oidclogin.domain.entity.OidcClientConfig;
import com.example.oidclogin.domain.entity.TokenSource;
import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Centralized configuration properties for the OIDC login CLI.
 * Uses records for immutability and type safety.
 */
@Validated
@ConfigurationProperties(prefix = "app")
public record ApplicationProperties(
    @NotNull @Valid OidcProperties login,
    @NotNull @Valid ExecProperties exec,
    @NotNull @Valid ServiceAccountProperties serviceAccount,
    @NotNull @Valid CacheProperties cache,
    @NotNull @Valid OkHttpProperties http
) {

  /**
   * Identity provider settings for one OIDC public client
   */
  public record OidcProperties(
      @NotBlank String serverUrl,
      @NotBlank String realm,
      @NotBlank String clientId,
      @NotEmpty List<String> scopes,
      @Min(1) @Max(65535) int callbackPort,
      @NotBlank String callbackPath,
      @NotNull Duration timeout,
      boolean validateDiscovery,
      boolean requireIdToken
  ) {

    public String issuerUrl() {
      return issuerUrl(realm);
    }

    public String issuerUrl(String realmName) {
      return stripTrailingSlash(serverUrl) + "/realms/" + realmName;
    }

    public OidcClientConfig toClientConfig() {
      return toClientConfig(realm);
    }

    /**
     * Builds the value object threaded through the login components, optionally for another realm.
     */
    public OidcClientConfig toClientConfig(String realmOverride) {
      String realmName = realmOverride == null || realmOverride.isBlank() ? realm : realmOverride;
      return new OidcClientConfig(
          realmName,
          issuerUrl(realmName),
          clientId,
          List.copyOf(scopes),
          callbackPort,
          callbackPath,
          timeout,
          validateDiscovery,
          requireIdToken
      );
    }

    private static String stripTrailingSlash(String url) {
      return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
  }

  /**
   * Kubernetes credential-exec plugin configuration
   */
  public record ExecProperties(
      @NotNull @Valid OidcProperties oidc,
      @NotBlank String interactiveModeVariable,
      @NotEmpty List<String> interactiveModes,
      @NotBlank String apiVersion,
      @NotNull TokenSource tokenSource
  ) {}

  /**
   * Client-credentials (service account) configuration
   */
  public record ServiceAccountProperties(@NotNull Path secretsDirectory) {}

  /**
   * Token cache and login context storage
   */
  public record CacheProperties(
      @NotNull Path directory,
      @NotNull Path contextDirectory,
      @NotNull Duration refreshWindow
  ) {}

  /**
   * OkHttp client timeouts for identity provider calls
   */
  public record OkHttpProperties(
      @NotNull Duration connectTimeout,
      @NotNull Duration readTimeout,
      @NotNull Duration writeTimeout
  ) {}
}
