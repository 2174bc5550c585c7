package com.example.oidclogin.domain.entity;

/**
 * The single terminating request accepted by the callback listener.
 * Exactly one of {@code code} or {@code error} is set.
 */
public record CallbackResult(
    CallbackState state,
    String code,
    String error,
    String errorDescription
) {

  public static CallbackResult code(String code) {
    return new CallbackResult(CallbackState.CODE_RECEIVED, code, null, null);
  }

  public static CallbackResult error(String error, String errorDescription) {
    return new CallbackResult(CallbackState.ERROR_RECEIVED, null, error, errorDescription);
  }

  public boolean isSuccess() {
    return state == CallbackState.CODE_RECEIVED;
  }

  @Override
  public String toString() {
    return "CallbackResult[state=" + state + ", error=" + error + "]";
  }
}
