package com.example.oidclogin.cli;

import com.example.oidclogin.service.ExecCredentialService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * Entry point for kubectl's {@code exec} credential plugin configuration.
 * Standard output carries the credential document and nothing else.
 */
@Component
@RequiredArgsConstructor
@Command(name = "exec-credential", mixinStandardHelpOptions = true,
    description = "Print a Kubernetes ExecCredential for kubectl (client.authentication.k8s.io).")
public class ExecCredentialCommand implements Callable<Integer> {

  private final ExecCredentialService execCredentialService;

  @Spec
  CommandSpec spec;

  @Override
  public Integer call() {
    execCredentialService.writeCredential(spec.commandLine().getOut());
    return CliExitCodes.OK;
  }
}
