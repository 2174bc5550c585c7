package com.example.oidclogin;

import com.example.oidclogin.cli.CliExceptionHandler;
import com.example.oidclogin.cli.OidcLoginCommand;
import com.example.oidclogin.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import picocli.CommandLine;

/**
 * OIDC Login CLI
 *
 * Browser-based authorization code + PKCE login against Keycloak-style providers with:
 * - a local loopback callback listener
 * - a file-backed token cache and login context
 * - a kubectl exec credential plugin
 * - client-credentials tokens for service accounts
 */
@SpringBootApplication
@EnableConfigurationProperties(ApplicationProperties.class)
@RequiredArgsConstructor
public class OidcLoginApplication implements CommandLineRunner, ExitCodeGenerator {

  private final CommandLine.IFactory factory;
  private final OidcLoginCommand oidcLoginCommand;
  private final CliExceptionHandler cliExceptionHandler;

  private int exitCode;

  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(OidcLoginApplication.class);
    app.setLazyInitialization(false);
    System.exit(SpringApplication.exit(app.run(args)));
  }

  @Override
  public void run(String... args) {
    exitCode = new CommandLine(oidcLoginCommand, factory)
        .setExecutionExceptionHandler(cliExceptionHandler)
        .setCaseInsensitiveEnumValuesAllowed(true)
        .execute(args);
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }
}
