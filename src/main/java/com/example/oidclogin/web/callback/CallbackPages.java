package com.example.oidclogin.web.callback;

import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Static HTML pages returned to the browser by the callback listener.
 */
@Component
public class CallbackPages {

  private static final String SUCCESS_TEMPLATE = "templates/callback-success.html";
  private static final String ERROR_TEMPLATE = "templates/callback-error.html";
  private static final String MESSAGE_PLACEHOLDER = "{{message}}";

  private final String successPage;
  private final String errorTemplate;

  public CallbackPages() {
    this.successPage = load(SUCCESS_TEMPLATE);
    this.errorTemplate = load(ERROR_TEMPLATE);
  }

  public String success() {
    return successPage;
  }

  /**
   * Renders the failure page. {@code message} may come from the request and is escaped.
   */
  public String failure(String message) {
    return errorTemplate.replace(MESSAGE_PLACEHOLDER, escapeHtml(message));
  }

  static String escapeHtml(String value) {
    if (value == null) {
      return "";
    }
    StringBuilder escaped = new StringBuilder(value.length());
    for (char c : value.toCharArray()) {
      switch (c) {
        case '<' -> escaped.append("&lt;");
        case '>' -> escaped.append("&gt;");
        case '&' -> escaped.append("&amp;");
        case '"' -> escaped.append("&quot;");
        case '\'' -> escaped.append("&#39;");
        default -> escaped.append(c);
      }
    }
    return escaped.toString();
  }

  private static String load(String location) {
    try (InputStream in = new ClassPathResource(location).getInputStream()) {
      return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Missing callback page template: " + location, e);
    }
  }
}
