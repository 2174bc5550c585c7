package com.example.oidclogin.config;

import com.example.oidclogin.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration validator that enforces rules beyond basic JSR-303 validation.
 * Collects every violation and fails fast at startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@EnableConfigurationProperties(ApplicationProperties.class)
public class ConfigurationValidator implements InitializingBean {

  private static final String ERROR_INVALID_URL = "%s is invalid: %s";
  private static final String ERROR_HTTPS_REQUIRED = "%s must use HTTPS unless it points at localhost: %s";
  private static final String ERROR_DURATION_RANGE = "%s must be between %s and %s, but was: %s";
  private static final String SCHEME_HTTPS = "https";
  private static final String SCHEME_HTTP = "http";
  private static final List<String> LOCAL_HOSTS = List.of("localhost", "127.0.0.1", "[::1]", "::1");
  private static final String PATH_PREFIX_SLASH = "/";
  private static final String OPENID_SCOPE = "openid";
  private static final Duration MIN_LOGIN_TIMEOUT = Duration.ofSeconds(10);
  private static final Duration MAX_LOGIN_TIMEOUT = Duration.ofMinutes(30);
  private static final Duration MAX_HTTP_TIMEOUT = Duration.ofMinutes(1);
  private static final Duration MAX_REFRESH_WINDOW = Duration.ofMinutes(30);

  private final ApplicationProperties properties;

  @Override
  public void afterPropertiesSet() {
    log.debug("Validating application configuration...");
    List<String> errors = validate();

    if (!errors.isEmpty()) {
      String errorMessage = String.format("Configuration validation failed with %d error(s):\n- %s",
                                          errors.size(), String.join("\n- ", errors));
      log.error(errorMessage);
      throw new IllegalStateException(errorMessage);
    }
    log.debug("Configuration validated successfully.");
  }

  List<String> validate() {
    List<String> errors = new ArrayList<>();
    validateOidcConfig(properties.login(), "Login", errors);
    validateOidcConfig(properties.exec().oidc(), "Exec", errors);
    validateExecConfig(errors);
    validateCacheConfig(errors);
    validateHttpConfig(errors);
    return errors;
  }

  private void validateOidcConfig(ApplicationProperties.OidcProperties oidc, String label, List<String> errors) {
    String serverUrl = oidc.serverUrl();
    URI uri = parseUri(serverUrl);
    if (uri == null || uri.getHost() == null
        || !(SCHEME_HTTPS.equals(uri.getScheme()) || SCHEME_HTTP.equals(uri.getScheme()))) {
      errors.add(ERROR_INVALID_URL.formatted(label + " server URL", serverUrl));
    } else if (SCHEME_HTTP.equals(uri.getScheme()) && !LOCAL_HOSTS.contains(uri.getHost())) {
      errors.add(ERROR_HTTPS_REQUIRED.formatted(label + " server URL", serverUrl));
    }

    if (oidc.realm().contains("/")) {
      errors.add(label + " realm must be a single path segment: " + oidc.realm());
    }
    if (!oidc.callbackPath().startsWith(PATH_PREFIX_SLASH)) {
      errors.add(label + " callback path must start with a '/': " + oidc.callbackPath());
    }
    if (oidc.requireIdToken() && !oidc.scopes().contains(OPENID_SCOPE)) {
      errors.add(label + " requires an ID token, so its scopes must include 'openid'.");
    }
    validateDurationRange(oidc.timeout(), label + " timeout", MIN_LOGIN_TIMEOUT, MAX_LOGIN_TIMEOUT, errors);
  }

  private void validateExecConfig(List<String> errors) {
    String apiVersion = properties.exec().apiVersion();
    if (!apiVersion.startsWith("client.authentication.k8s.io/")) {
      errors.add("Exec API version must belong to the client.authentication.k8s.io group: " + apiVersion);
    }
  }

  private void validateCacheConfig(List<String> errors) {
    ApplicationProperties.CacheProperties cache = properties.cache();
    if (cache.directory().normalize().equals(cache.contextDirectory().normalize())) {
      errors.add("Token cache directory and context directory must differ.");
    }
    validateDurationRange(cache.refreshWindow(), "Cache refresh window", Duration.ZERO, MAX_REFRESH_WINDOW, errors);
  }

  private void validateHttpConfig(List<String> errors) {
    ApplicationProperties.OkHttpProperties http = properties.http();
    validateDurationRange(http.connectTimeout(), "HTTP connect timeout", Duration.ofMillis(100), MAX_HTTP_TIMEOUT, errors);
    validateDurationRange(http.readTimeout(), "HTTP read timeout", Duration.ofMillis(100), MAX_HTTP_TIMEOUT, errors);
    validateDurationRange(http.writeTimeout(), "HTTP write timeout", Duration.ofMillis(100), MAX_HTTP_TIMEOUT, errors);
  }

  private void validateDurationRange(Duration value, String fieldName, Duration min, Duration max, List<String> errors) {
    if (value.compareTo(min) < 0 || value.compareTo(max) > 0) {
      errors.add(ERROR_DURATION_RANGE.formatted(fieldName, min, max, value));
    }
  }

  private URI parseUri(String value) {
    try {
      return new URI(value);
    } catch (URISyntaxException e) {
      return null;
    }
  }
}
