package com.example.oidclogin.util;

import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.JWTParser;
import lombok.experimental.UtilityClass;

import java.text.ParseException;
import java.util.Optional;

/**
 * Reads JWT claims without verifying the signature.
 * Only for displaying the caller's own tokens; never for authorization decisions.
 */
@UtilityClass
public class JwtClaimsReader {

  public static Optional<JWTClaimsSet> readUnverifiedClaims(String token) {
    if (token == null || token.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(JWTParser.parse(token).getJWTClaimsSet());
    } catch (ParseException e) {
      return Optional.empty();
    }
  }
}
