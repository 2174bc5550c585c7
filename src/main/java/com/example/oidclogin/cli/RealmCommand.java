package com.example.oidclogin.cli;

import com.example.oidclogin.domain.entity.CacheEntry;
import com.example.oidclogin.properties.ApplicationProperties;
import com.example.oidclogin.service.LoginSessionService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.Optional;

@Component
@RequiredArgsConstructor
@Command(name = "realm", mixinStandardHelpOptions = true, description = "Show or change the current realm.")
public class RealmCommand implements Runnable {

  private final LoginSessionService loginSessionService;
  private final ApplicationProperties properties;

  @Spec
  CommandSpec spec;

  @Override
  public void run() {
    throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand: show or set");
  }

  @Command(name = "show", description = "Print the realm of the current login, or the configured default.")
  int show() {
    Optional<CacheEntry> context = loginSessionService.current();
    String realm = context.map(CacheEntry::realm).orElse(properties.login().realm());
    spec.commandLine().getOut().println(realm + (context.isPresent() ? "" : " (default, not logged in)"));
    spec.commandLine().getOut().flush();
    return CliExitCodes.OK;
  }

  @Command(name = "set", description = "Switch the current login context to another realm.")
  int set(@Parameters(paramLabel = "REALM", description = "Realm name.") String realm) {
    CacheEntry context = loginSessionService.setRealm(realm);
    spec.commandLine().getOut().printf("Current realm set to '%s'.%n", context.realm());
    spec.commandLine().getOut().flush();
    return CliExitCodes.OK;
  }
}
