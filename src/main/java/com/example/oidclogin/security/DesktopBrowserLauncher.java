package com.example.oidclogin.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.awt.Desktop;
import java.awt.GraphicsEnvironment;
import java.io.PrintStream;
import java.net.URI;

/**
 * Opens the system browser through {@link Desktop}; falls back to printing the URL.
 * Instructions go to standard error so standard output stays clean for exec credentials.
 */
@Slf4j
@Component
public class DesktopBrowserLauncher implements BrowserLauncher {

  private final PrintStream console;

  public DesktopBrowserLauncher() {
    this(System.err);
  }

  DesktopBrowserLauncher(PrintStream console) {
    this.console = console;
  }

  @Override
  public void open(String url) {
    console.println("Opening browser for authentication...");
    console.println("If the browser does not open, visit:");
    console.println("    " + url);

    if (!canBrowse()) {
      log.debug("No desktop browser available, URL printed for manual navigation");
      return;
    }
    try {
      Desktop.getDesktop().browse(URI.create(url));
    } catch (Exception e) {
      log.warn("Could not open browser automatically: {}", e.getMessage());
    }
  }

  private boolean canBrowse() {
    try {
      return !GraphicsEnvironment.isHeadless()
          && Desktop.isDesktopSupported()
          && Desktop.getDesktop().isSupported(Desktop.Action.BROWSE);
    } catch (RuntimeException e) {
      return false;
    }
  }
}
