package com.example.oidclogin.cli;

import com.example.oidclogin.service.LoginSessionService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Component
@RequiredArgsConstructor
@Command(name = "logout", mixinStandardHelpOptions = true, description = "Forget the current login.")
public class LogoutCommand implements Callable<Integer> {

  private final LoginSessionService loginSessionService;

  @Spec
  CommandSpec spec;

  @Override
  public Integer call() {
    boolean loggedOut = loginSessionService.logout();
    spec.commandLine().getOut().println(loggedOut ? "Logged out." : "Not logged in.");
    spec.commandLine().getOut().flush();
    return CliExitCodes.OK;
  }
}
