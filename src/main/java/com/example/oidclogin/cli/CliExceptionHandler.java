package com.example.oidclogin.cli;

import com.example.oidclogin.exception.AuthenticationFlowException;
import com.example.oidclogin.exception.AuthorizationException;
import com.example.oidclogin.exception.CacheException;
import com.example.oidclogin.exception.ProtocolModeException;
import com.example.oidclogin.exception.TokenExchangeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

/**
 * Single boundary turning command failures into one line on standard error and an exit code.
 * Nothing is ever written to standard output from here.
 */
@Slf4j
@Component
public class CliExceptionHandler implements CommandLine.IExecutionExceptionHandler {

  @Override
  public int handleExecutionException(Exception ex, CommandLine commandLine, CommandLine.ParseResult parseResult) {
    log.debug("Command '{}' failed", commandLine.getCommandName(), ex);

    commandLine.getErr().println(commandLine.getColorScheme().errorText("Error: " + describe(ex)));
    commandLine.getErr().flush();
    return exitCodeFor(ex);
  }

  static int exitCodeFor(Exception ex) {
    if (ex instanceof ProtocolModeException) {
      return CliExitCodes.PROTOCOL_MODE;
    }
    if (ex instanceof AuthenticationFlowException || ex instanceof CacheException) {
      return CliExitCodes.FLOW_FAILURE;
    }
    if (ex instanceof IllegalArgumentException) {
      return CliExitCodes.USAGE;
    }
    return CliExitCodes.FLOW_FAILURE;
  }

  static String describe(Exception ex) {
    if (ex instanceof TokenExchangeException tokenError && tokenError.getStatus() > 0) {
      return ex.getMessage() + " [HTTP " + tokenError.getStatus() + "]";
    }
    if (ex instanceof AuthorizationException authError) {
      return ex.getMessage() + " [" + authError.getErrorCode() + "]";
    }
    return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
  }
}
