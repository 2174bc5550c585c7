package com.example.oidclogin.security;

import com.example.oidclogin.domain.entity.PkcePair;
import com.nimbusds.oauth2.sdk.id.State;
import com.nimbusds.oauth2.sdk.pkce.CodeChallenge;
import com.nimbusds.oauth2.sdk.pkce.CodeChallengeMethod;
import com.nimbusds.oauth2.sdk.pkce.CodeVerifier;
import org.springframework.stereotype.Component;

/**
 * Generates PKCE pairs and CSRF state values.
 *
 * The verifier is 32 bytes from a {@code SecureRandom}, base64url-encoded without padding
 * (43 characters); the challenge is {@code base64url(SHA-256(verifier))}.
 */
@Component
public class PkceGenerator {

  public PkcePair generate() {
    CodeVerifier codeVerifier = new CodeVerifier();
    CodeChallenge codeChallenge = CodeChallenge.compute(CodeChallengeMethod.S256, codeVerifier);
    return new PkcePair(codeVerifier.getValue(), codeChallenge.getValue());
  }

  public String newState() {
    return new State().getValue();
  }
}
