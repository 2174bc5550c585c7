package com.example.oidclogin.exception;

/**
 * Base class for fatal login-flow failures. Messages never contain token material.
 */
public class AuthenticationFlowException extends RuntimeException {
  public AuthenticationFlowException(String message) {
    super(message);
  }

  public AuthenticationFlowException(String message, Throwable cause) {
    super(message, cause);
  }
}
