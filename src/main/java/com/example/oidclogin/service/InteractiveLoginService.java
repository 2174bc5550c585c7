package com.example.oidclogin.service;

import com.example.oidclogin.domain.entity.AuthSession;
import com.example.oidclogin.domain.entity.CallbackResult;
import com.example.oidclogin.domain.entity.OidcClientConfig;
import com.example.oidclogin.domain.entity.PkcePair;
import com.example.oidclogin.domain.entity.ProviderEndpoints;
import com.example.oidclogin.domain.entity.TokenSet;
import com.example.oidclogin.exception.LoginInProgressException;
import com.example.oidclogin.security.AuthorizationRequestBuilder;
import com.example.oidclogin.security.BrowserLauncher;
import com.example.oidclogin.security.PkceGenerator;
import com.example.oidclogin.web.callback.CallbackListener;
import com.example.oidclogin.web.callback.CallbackPages;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one authorization-code + PKCE login in the user's browser.
 *
 * <p>The callback listener is bound before the browser is opened and is closed on every exit
 * path. Only one login may be in flight per process, whatever thread asks; a second caller fails
 * immediately instead of competing for the callback port.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InteractiveLoginService {

  private final PkceGenerator pkceGenerator;
  private final AuthorizationRequestBuilder authorizationRequestBuilder;
  private final BrowserLauncher browserLauncher;
  private final CallbackPages callbackPages;
  private final TokenExchangeService tokenExchangeService;

  private final AtomicBoolean loginInProgress = new AtomicBoolean();

  /**
   * Drives the flow to a terminal state.
   *
   * @return the freshly issued tokens; the caller decides where to store them
   * @throws LoginInProgressException if another login is running in this process
   * @throws com.example.oidclogin.exception.AuthenticationFlowException on any flow failure
   */
  public TokenSet login(OidcClientConfig config) {
    if (!loginInProgress.compareAndSet(false, true)) {
      throw new LoginInProgressException("Another login is already in progress");
    }
    try {
      return runFlow(config);
    } finally {
      loginInProgress.set(false);
    }
  }

  public boolean isLoginInProgress() {
    return loginInProgress.get();
  }

  private TokenSet runFlow(OidcClientConfig config) {
    PkcePair pkce = pkceGenerator.generate();
    AuthSession session = AuthSession.start(config, pkce, pkceGenerator.newState());
    log.debug("Starting interactive login: {}", session);

    ProviderEndpoints endpoints = tokenExchangeService.resolveEndpoints(config);

    try (CallbackListener listener =
             new CallbackListener(session, config.callbackPort(), config.callbackPath(), callbackPages).start()) {

      String authorizationUrl = authorizationRequestBuilder.build(endpoints.authorizationEndpoint(), session);
      browserLauncher.open(authorizationUrl);

      CallbackResult callback = listener.await(config.timeout());
      log.debug("Callback completed, exchanging authorization code");

      return tokenExchangeService.exchangeAuthorizationCode(
          endpoints, session, callback.code(), config.requireIdToken());
    }
  }
}
