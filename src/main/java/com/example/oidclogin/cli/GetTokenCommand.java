package com.example.oidclogin.cli;

import com.example.oidclogin.domain.entity.ServiceAccountCredentials;
import com.example.oidclogin.domain.entity.TokenSet;
import com.example.oidclogin.service.ServiceAccountCredentialsResolver;
import com.example.oidclogin.service.ServiceAccountTokenService;
import com.example.oidclogin.util.TokenMasker;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Client-credentials token for a service account.
 */
@Component
@RequiredArgsConstructor
@Command(name = "get-token", mixinStandardHelpOptions = true,
    description = "Obtain a service account access token with the client-credentials grant.")
public class GetTokenCommand implements Callable<Integer> {

  enum OutputFormat { TOKEN, JSON, TABLE }

  private final ServiceAccountCredentialsResolver credentialsResolver;
  private final ServiceAccountTokenService serviceAccountTokenService;
  private final ObjectMapper objectMapper;

  @Spec
  CommandSpec spec;

  @Option(names = "--client-id", description = "Service account client id.")
  String clientId;

  @Option(names = "--client-secret", description = "Service account client secret.")
  String clientSecret;

  @Option(names = {"-r", "--realm"}, description = "Realm (default: configured realm).")
  String realm;

  @Option(names = "--no-cache", description = "Always request a new token.")
  boolean noCache;

  @Option(names = {"-o", "--output"}, defaultValue = "TOKEN",
      description = "Output format, case-insensitive: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE}).")
  OutputFormat output;

  @Override
  public Integer call() throws JsonProcessingException {
    ServiceAccountCredentials credentials = credentialsResolver.resolve(clientId, clientSecret);
    TokenSet tokens = serviceAccountTokenService.getToken(credentials, realm, !noCache);

    PrintWriter out = spec.commandLine().getOut();
    switch (output) {
      case JSON -> out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(credentials, tokens)));
      case TABLE -> {
        out.printf("%-12s %s%n", "Client:", credentials.clientId());
        out.printf("%-12s %s%n", "Type:", tokens.tokenType());
        out.printf("%-12s %s%n", "Expires:", tokens.expiresAt());
        out.printf("%-12s %s%n", "Scope:", tokens.scope());
        out.printf("%-12s %s%n", "Token:", TokenMasker.mask(tokens.accessToken()));
      }
      default -> out.println(tokens.accessToken());
    }
    out.flush();
    return CliExitCodes.OK;
  }

  private static Map<String, Object> toJson(ServiceAccountCredentials credentials, TokenSet tokens) {
    Map<String, Object> json = new LinkedHashMap<>();
    json.put("client_id", credentials.clientId());
    json.put("token_type", tokens.tokenType());
    json.put("expires_at", tokens.expiresAt().toString());
    json.put("scope", tokens.scope());
    json.put("access_token", tokens.accessToken());
    return json;
  }
}
