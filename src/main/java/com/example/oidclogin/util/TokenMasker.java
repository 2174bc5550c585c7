package com.example.oidclogin.util;

import lombok.experimental.UtilityClass;

/**
 * Short previews of secrets for log lines and table output.
 */
@UtilityClass
public class TokenMasker {

  private static final int VISIBLE_PREFIX = 8;
  private static final int VISIBLE_SUFFIX = 4;

  public static String mask(String token) {
    if (token == null || token.isEmpty()) {
      return "<none>";
    }
    if (token.length() <= VISIBLE_PREFIX + VISIBLE_SUFFIX) {
      return "***";
    }
    return token.substring(0, VISIBLE_PREFIX) + "..." + token.substring(token.length() - VISIBLE_SUFFIX);
  }
}
