package com.example.oidclogin.exception;

/**
 * The exec-credential plugin was invoked by a client that cannot run an interactive login.
 */
public class ProtocolModeException extends AuthenticationFlowException {
  public ProtocolModeException(String message) {
    super(message);
  }
}
