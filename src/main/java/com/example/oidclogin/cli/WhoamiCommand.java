package com.example.oidclogin.cli;

import com.example.oidclogin.domain.entity.IdentitySummary;
import com.example.oidclogin.service.LoginSessionService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Prints claims of the current login. The token signature is not verified.
 */
@Component
@RequiredArgsConstructor
@Command(name = "whoami", mixinStandardHelpOptions = true, description = "Show who is logged in.")
public class WhoamiCommand implements Callable<Integer> {

  private final LoginSessionService loginSessionService;

  @Spec
  CommandSpec spec;

  @Override
  public Integer call() {
    IdentitySummary identity = loginSessionService.whoami();

    PrintWriter out = spec.commandLine().getOut();
    printLine(out, "Username", identity.username());
    printLine(out, "Email", identity.email());
    printLine(out, "Name", identity.name());
    printLine(out, "Subject", identity.subject());
    printLine(out, "Realm", identity.realm());
    printLine(out, "Issuer", identity.issuer());
    printLine(out, "Expires", identity.expiresAt() + (identity.expired() ? " (expired)" : ""));
    out.flush();
    return CliExitCodes.OK;
  }

  private static void printLine(PrintWriter out, String label, String value) {
    out.printf("%-9s %s%n", label + ":", value != null ? value : "-");
  }
}
