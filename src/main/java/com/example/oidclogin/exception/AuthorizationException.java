package com.example.oidclogin.exception;

import lombok.Getter;

/**
 * The authorization step failed: the provider redirected with an error, the state did not
 * match, or the callback endpoint could not be bound.
 */
@Getter
public class AuthorizationException extends AuthenticationFlowException {

  public static final String STATE_MISMATCH = "state_mismatch";
  public static final String CALLBACK_UNAVAILABLE = "callback_unavailable";

  private final String errorCode;

  public AuthorizationException(String errorCode, String message) {
    super(message);
    this.errorCode = errorCode;
  }

  public AuthorizationException(String errorCode, String message, Throwable cause) {
    super(message, cause);
    this.errorCode = errorCode;
  }
}
