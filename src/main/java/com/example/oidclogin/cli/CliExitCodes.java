package com.example.oidclogin.cli;

public final class CliExitCodes {

  public static final int OK = 0;
  public static final int FLOW_FAILURE = 1;
  public static final int USAGE = 2;
  public static final int PROTOCOL_MODE = 3;

  private CliExitCodes() {
  }
}
