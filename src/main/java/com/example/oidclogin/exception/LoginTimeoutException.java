package com.example.oidclogin.exception;

/**
 * No callback arrived before the login deadline.
 */
public class LoginTimeoutException extends AuthenticationFlowException {
  public LoginTimeoutException(String message) {
    super(message);
  }
}
