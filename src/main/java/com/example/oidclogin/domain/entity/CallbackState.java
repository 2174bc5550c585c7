package com.example.oidclogin.domain.entity;

/**
 * States of the local redirect listener. Every state but {@code WAITING} is terminal.
 */
public enum CallbackState {
  WAITING,
  CODE_RECEIVED,
  ERROR_RECEIVED,
  TIMED_OUT;

  public boolean isTerminal() {
    return this != WAITING;
  }
}
