package com.example.oidclogin.exception;

/**
 * Discovery document could not be fetched, is missing a required field, or names another issuer.
 */
public class DiscoveryValidationException extends AuthenticationFlowException {
  public DiscoveryValidationException(String message) {
    super(message);
  }

  public DiscoveryValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
