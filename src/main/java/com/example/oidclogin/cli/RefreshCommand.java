package com.example.oidclogin.cli;

import com.example.oidclogin.domain.entity.CacheEntry;
import com.example.oidclogin.service.LoginSessionService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Component
@RequiredArgsConstructor
@Command(name = "refresh", mixinStandardHelpOptions = true,
    description = "Redeem the current context's refresh token for new tokens.")
public class RefreshCommand implements Callable<Integer> {

  private final LoginSessionService loginSessionService;

  @Spec
  CommandSpec spec;

  @Override
  public Integer call() {
    CacheEntry context = loginSessionService.refresh();
    spec.commandLine().getOut().printf("Tokens refreshed, new expiry %s.%n", context.tokens().expiresAt());
    spec.commandLine().getOut().flush();
    return CliExitCodes.OK;
  }
}
