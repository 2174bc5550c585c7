package com.example.oidclogin.cli;

import com.example.oidclogin.domain.entity.CacheEntry;
import com.example.oidclogin.service.LoginSessionService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Component
@RequiredArgsConstructor
@Command(name = "login", mixinStandardHelpOptions = true,
    description = "Log in through the browser and make the result the current context.")
public class LoginCommand implements Callable<Integer> {

  private final LoginSessionService loginSessionService;

  @Spec
  CommandSpec spec;

  @Option(names = {"-r", "--realm"}, description = "Realm to log in to (default: configured realm).")
  String realm;

  @Override
  public Integer call() {
    CacheEntry context = loginSessionService.login(realm);

    PrintWriter out = spec.commandLine().getOut();
    out.printf("Logged in to realm '%s' (client %s).%n", context.realm(), context.clientId());
    out.printf("Token expires at %s.%n", context.tokens().expiresAt());
    out.flush();
    return CliExitCodes.OK;
  }
}
