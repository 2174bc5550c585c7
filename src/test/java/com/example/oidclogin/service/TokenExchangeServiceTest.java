package com.example.oidclogin.service;

import com.example.oidclogin.adapter.idp.OidcProviderClient;
import com.example.oidclogin.adapter.idp.dto.DiscoveryDocument;
import com.example.oidclogin.adapter.idp.dto.TokenEndpointResponse;
import com.example.oidclogin.domain.entity.AuthSession;
import com.example.oidclogin.domain.entity.OidcClientConfig;
import com.example.oidclogin.domain.entity.ProviderEndpoints;
import com.example.oidclogin.domain.entity.ServiceAccountCredentials;
import com.example.oidclogin.domain.entity.TokenSet;
import com.example.oidclogin.exception.DiscoveryValidationException;
import com.example.oidclogin.exception.TokenExchangeException;
import com.example.oidclogin.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TokenExchangeServiceTest {

  private static final String ISSUER = "https://idp.example.com/realms/test";
  private static final String TOKEN_ENDPOINT = ISSUER + "/protocol/openid-connect/token";
  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  @Mock
  private OidcProviderClient providerClient;

  private TokenExchangeService service;

  private final ProviderEndpoints endpoints =
      new ProviderEndpoints(ISSUER, ISSUER + "/protocol/openid-connect/auth", TOKEN_ENDPOINT);
  private final AuthSession session = new AuthSession("the-verifier", "the-challenge", "state",
      "http://localhost:8765/callback", ISSUER, "itl-cli", List.of("openid"));

  @BeforeEach
  void setUp() {
    service = new TokenExchangeService(providerClient, new MutableClock(NOW));
  }

  @Test
  void acceptsWellFormedDiscoveryDocumentForTheIssuer() {
    when(providerClient.fetchDiscoveryDocument(ISSUER)).thenReturn(document(ISSUER, TOKEN_ENDPOINT));

    ProviderEndpoints resolved = service.resolveEndpoints(config(true));

    assertThat(resolved.issuer()).isEqualTo(ISSUER);
    assertThat(resolved.tokenEndpoint()).isEqualTo(TOKEN_ENDPOINT);
  }

  @Test
  void rejectsDiscoveryDocumentForAnotherIssuer() {
    when(providerClient.fetchDiscoveryDocument(ISSUER))
        .thenReturn(document("https://evil.example.com/realms/test", TOKEN_ENDPOINT));

    assertThatThrownBy(() -> service.validateDiscovery(ISSUER))
        .isInstanceOf(DiscoveryValidationException.class)
        .hasMessageContaining("Issuer mismatch");
  }

  @Test
  void rejectsIssuerThatDiffersOnlyByTrailingSlash() {
    when(providerClient.fetchDiscoveryDocument(ISSUER)).thenReturn(document(ISSUER + "/", TOKEN_ENDPOINT));

    assertThatThrownBy(() -> service.validateDiscovery(ISSUER))
        .isInstanceOf(DiscoveryValidationException.class);
  }

  @Test
  void rejectsDiscoveryDocumentWithoutTokenEndpoint() {
    when(providerClient.fetchDiscoveryDocument(ISSUER)).thenReturn(document(ISSUER, null));

    assertThatThrownBy(() -> service.validateDiscovery(ISSUER))
        .isInstanceOf(DiscoveryValidationException.class)
        .hasMessageContaining("token_endpoint");
  }

  @Test
  void rejectsEmptyDiscoveryDocument() {
    when(providerClient.fetchDiscoveryDocument(ISSUER)).thenReturn(null);

    assertThatThrownBy(() -> service.validateDiscovery(ISSUER))
        .isInstanceOf(DiscoveryValidationException.class);
  }

  @Test
  void usesDefaultEndpointsWithoutDiscovery() {
    ProviderEndpoints resolved = service.resolveEndpoints(config(false));

    assertThat(resolved.tokenEndpoint()).isEqualTo(TOKEN_ENDPOINT);
    verify(providerClient, never()).fetchDiscoveryDocument(anyString());
  }

  @Test
  @SuppressWarnings("unchecked")
  void exchangesCodeWithVerifierAndComputesExpiry() {
    when(providerClient.requestToken(eq(TOKEN_ENDPOINT), anyMap()))
        .thenReturn(response("at", 300L, "it"));

    TokenSet tokens = service.exchangeAuthorizationCode(endpoints, session, "abc123", true);

    assertThat(tokens.accessToken()).isEqualTo("at");
    assertThat(tokens.idToken()).isEqualTo("it");
    assertThat(tokens.expiresAt()).isEqualTo(NOW.plusSeconds(300));

    ArgumentCaptor<Map<String, String>> form = ArgumentCaptor.forClass(Map.class);
    verify(providerClient).requestToken(eq(TOKEN_ENDPOINT), form.capture());
    assertThat(form.getValue())
        .containsEntry("grant_type", "authorization_code")
        .containsEntry("code", "abc123")
        .containsEntry("redirect_uri", "http://localhost:8765/callback")
        .containsEntry("client_id", "itl-cli")
        .containsEntry("code_verifier", "the-verifier");
  }

  @Test
  void defaultsExpiryToOneHour() {
    when(providerClient.requestToken(eq(TOKEN_ENDPOINT), anyMap())).thenReturn(response("at", null, null));

    TokenSet tokens = service.exchangeAuthorizationCode(endpoints, session, "abc123", false);

    assertThat(tokens.expiresAt()).isEqualTo(NOW.plus(Duration.ofHours(1)));
    assertThat(tokens.tokenType()).isEqualTo("Bearer");
  }

  @Test
  void missingAccessTokenIsAnError() {
    when(providerClient.requestToken(eq(TOKEN_ENDPOINT), anyMap())).thenReturn(response(null, 300L, "it"));

    assertThatThrownBy(() -> service.exchangeAuthorizationCode(endpoints, session, "abc123", false))
        .isInstanceOf(TokenExchangeException.class)
        .hasMessageContaining("access_token");
  }

  @Test
  void missingIdTokenIsAnErrorWhenRequired() {
    when(providerClient.requestToken(eq(TOKEN_ENDPOINT), anyMap())).thenReturn(response("at", 300L, null));

    assertThatThrownBy(() -> service.exchangeAuthorizationCode(endpoints, session, "abc123", true))
        .isInstanceOf(TokenExchangeException.class)
        .hasMessageContaining("id_token");
  }

  @Test
  void refreshKeepsPreviousRefreshTokenWhenNotRotated() {
    when(providerClient.requestToken(eq(TOKEN_ENDPOINT), anyMap())).thenReturn(response("new-at", 300L, null));

    TokenSet tokens = service.refresh(TOKEN_ENDPOINT, "itl-cli", "old-rt");

    assertThat(tokens.accessToken()).isEqualTo("new-at");
    assertThat(tokens.refreshToken()).isEqualTo("old-rt");
  }

  @Test
  @SuppressWarnings("unchecked")
  void clientCredentialsSendsSecret() {
    when(providerClient.requestToken(eq(TOKEN_ENDPOINT), anyMap())).thenReturn(response("sa-token", 60L, null));

    TokenSet tokens = service.clientCredentials(TOKEN_ENDPOINT, new ServiceAccountCredentials("sa", "s3cret", "test"));

    assertThat(tokens.accessToken()).isEqualTo("sa-token");
    ArgumentCaptor<Map<String, String>> form = ArgumentCaptor.forClass(Map.class);
    verify(providerClient).requestToken(eq(TOKEN_ENDPOINT), form.capture());
    assertThat(form.getValue())
        .containsEntry("grant_type", "client_credentials")
        .containsEntry("client_id", "sa")
        .containsEntry("client_secret", "s3cret");
  }

  private static OidcClientConfig config(boolean validateDiscovery) {
    return new OidcClientConfig("test", ISSUER, "itl-cli", List.of("openid"), 8765, "/callback",
        Duration.ofMinutes(1), validateDiscovery, false);
  }

  private static DiscoveryDocument document(String issuer, String tokenEndpoint) {
    return new DiscoveryDocument(issuer, ISSUER + "/protocol/openid-connect/auth", tokenEndpoint, null, null);
  }

  private static TokenEndpointResponse response(String accessToken, Long expiresIn, String idToken) {
    return new TokenEndpointResponse(accessToken, "Bearer", expiresIn, null, idToken, "openid", null, null);
  }
}
