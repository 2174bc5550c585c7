package com.example.oidclogin.exception;

/**
 * Another login attempt already owns the callback listener in this process.
 */
public class LoginInProgressException extends AuthenticationFlowException {
  public LoginInProgressException(String message) {
    super(message);
  }
}
