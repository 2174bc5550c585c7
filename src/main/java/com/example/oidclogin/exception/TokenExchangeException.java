package com.example.oidclogin.exception;

import lombok.Getter;

/**
 * The token endpoint answered with a non-success status, malformed JSON, or without a required
 * token, or could not be reached.
 */
@Getter
public class TokenExchangeException extends AuthenticationFlowException {

  private final String endpoint;
  // -1 when no HTTP response was received.
  private final int status;

  public TokenExchangeException(String endpoint, int status, String message) {
    super(message);
    this.endpoint = endpoint;
    this.status = status;
  }

  public TokenExchangeException(String endpoint, String message, Throwable cause) {
    super(message, cause);
    this.endpoint = endpoint;
    this.status = -1;
  }
}
