package com.example.oidclogin.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Component
@Command(
    name = "oidc-login",
    mixinStandardHelpOptions = true,
    version = "oidc-login 1.0.0",
    description = "Browser-based OpenID Connect login for CLIs and kubectl.",
    subcommands = {
        LoginCommand.class,
        LogoutCommand.class,
        RefreshCommand.class,
        WhoamiCommand.class,
        RealmCommand.class,
        GetTokenCommand.class,
        CacheCommand.class,
        ExecCredentialCommand.class
    }
)
public class OidcLoginCommand implements Runnable {

  @Spec
  CommandSpec spec;

  @Override
  public void run() {
    throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
  }
}
