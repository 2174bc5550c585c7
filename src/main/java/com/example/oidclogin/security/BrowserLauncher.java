package com.example.oidclogin.security;

/**
 * Shows the authorization URL to the user.
 */
public interface BrowserLauncher {

  /**
   * Opens {@code url} in the user's browser, or prints it when no browser can be opened.
   * Never fails the login flow.
   */
  void open(String url);
}
