package com.example.oidclogin.service;

import com.example.oidclogin.domain.entity.ServiceAccountCredentials;
import com.example.oidclogin.exception.AuthenticationFlowException;
import com.example.oidclogin.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Locates client-credentials secrets. First match wins: explicit values, then each pair of
 * environment variables in order, then the mounted secret files.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ServiceAccountCredentialsResolver {

  static final List<String[]> ENVIRONMENT_PAIRS = List.of(
      new String[] {"KEYCLOAK_CLIENT_ID", "KEYCLOAK_CLIENT_SECRET"},
      new String[] {"ITL_CLIENT_ID", "ITL_CLIENT_SECRET"}
  );
  static final String CLIENT_ID_FILE = "client-id";
  static final String CLIENT_SECRET_FILE = "client-secret";

  private final Environment environment;
  private final ApplicationProperties properties;

  public ServiceAccountCredentials resolve(String clientId, String clientSecret) {
    if (hasText(clientId) && hasText(clientSecret)) {
      return new ServiceAccountCredentials(clientId, clientSecret, "options");
    }

    for (String[] pair : ENVIRONMENT_PAIRS) {
      String envId = environment.getProperty(pair[0]);
      String envSecret = environment.getProperty(pair[1]);
      if (hasText(envId) && hasText(envSecret)) {
        return new ServiceAccountCredentials(envId, envSecret, "environment " + pair[0]);
      }
    }

    Optional<ServiceAccountCredentials> mounted = fromSecretFiles(properties.serviceAccount().secretsDirectory());
    if (mounted.isPresent()) {
      return mounted.get();
    }

    throw new AuthenticationFlowException(
        "No service account credentials found. Pass --client-id and --client-secret, set "
            + "KEYCLOAK_CLIENT_ID/KEYCLOAK_CLIENT_SECRET, or mount them under "
            + properties.serviceAccount().secretsDirectory());
  }

  private Optional<ServiceAccountCredentials> fromSecretFiles(Path directory) {
    Path idFile = directory.resolve(CLIENT_ID_FILE);
    Path secretFile = directory.resolve(CLIENT_SECRET_FILE);
    if (!Files.isReadable(idFile) || !Files.isReadable(secretFile)) {
      return Optional.empty();
    }
    try {
      String id = Files.readString(idFile, StandardCharsets.UTF_8).strip();
      String secret = Files.readString(secretFile, StandardCharsets.UTF_8).strip();
      if (id.isEmpty() || secret.isEmpty()) {
        return Optional.empty();
      }
      return Optional.of(new ServiceAccountCredentials(id, secret, "files in " + directory));
    } catch (IOException e) {
      log.warn("Cannot read service account secrets from {}: {}", directory, e.getMessage());
      return Optional.empty();
    }
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
