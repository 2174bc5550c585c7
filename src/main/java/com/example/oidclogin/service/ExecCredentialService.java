package com.example.oidclogin.service;

import com.example.oidclogin.domain.entity.ExecCredential;
import com.example.oidclogin.domain.entity.OidcClientConfig;
import com.example.oidclogin.domain.entity.TokenSet;
import com.example.oidclogin.domain.entity.TokenSource;
import com.example.oidclogin.exception.AuthenticationFlowException;
import com.example.oidclogin.exception.ProtocolModeException;
import com.example.oidclogin.properties.ApplicationProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.io.PrintWriter;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Kubernetes client-go credential plugin.
 *
 * <p>The only thing ever written to the supplied writer is one complete {@link ExecCredential}
 * JSON line. It is rendered in full before anything is written, so a failure leaves the
 * writer untouched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecCredentialService {

  static final String CACHE_KEY_PREFIX = "exec:";

  private final ApplicationProperties properties;
  private final Environment environment;
  private final TokenProviderService tokenProviderService;
  private final ObjectMapper objectMapper;

  public void writeCredential(PrintWriter out) {
    String document = renderCredential();
    out.println(document);
    out.flush();
  }

  /**
   * @throws ProtocolModeException if the caller did not announce an interactive session;
   *     raised before any cache or network access
   */
  public String renderCredential() {
    ApplicationProperties.ExecProperties exec = properties.exec();
    requireInteractiveMode(exec);

    OidcClientConfig config = exec.oidc().toClientConfig();
    TokenSet tokens = tokenProviderService.obtainTokens(config, cacheKey(config));

    String token = selectToken(tokens, exec.tokenSource());
    ExecCredential credential = ExecCredential.of(exec.apiVersion(), token, formatTimestamp(tokens.expiresAt()));
    try {
      String json = objectMapper.writeValueAsString(credential);
      log.debug("Exec credential issued for {} (expires {})", config.principalKey(), tokens.expiresAt());
      return json;
    } catch (JsonProcessingException e) {
      throw new AuthenticationFlowException("Failed to serialize exec credential", e);
    }
  }

  static String cacheKey(OidcClientConfig config) {
    return CACHE_KEY_PREFIX + config.principalKey();
  }

  /**
   * RFC 3339 in UTC with whole seconds, e.g. {@code 2024-05-01T10:15:30Z}.
   */
  static String formatTimestamp(Instant instant) {
    return DateTimeFormatter.ISO_INSTANT.format(instant.truncatedTo(ChronoUnit.SECONDS));
  }

  private void requireInteractiveMode(ApplicationProperties.ExecProperties exec) {
    String variable = exec.interactiveModeVariable();
    String mode = environment.getProperty(variable);
    if (mode == null || mode.isBlank()) {
      throw new ProtocolModeException(
          variable + " is not set; this command must be invoked by kubectl as an exec credential plugin");
    }
    if (!exec.interactiveModes().contains(mode)) {
      throw new ProtocolModeException(
          variable + "=" + mode + " does not allow the interactive browser login this plugin requires");
    }
  }

  private static String selectToken(TokenSet tokens, TokenSource source) {
    if (source == TokenSource.ACCESS_TOKEN) {
      return tokens.accessToken();
    }
    if (!tokens.hasIdToken()) {
      throw new AuthenticationFlowException("No ID token available for the exec credential");
    }
    return tokens.idToken();
  }
}
