package com.example.oidclogin.web.callback;

import com.example.oidclogin.domain.entity.AuthSession;
import com.example.oidclogin.domain.entity.CallbackResult;
import com.example.oidclogin.domain.entity.CallbackState;
import com.example.oidclogin.exception.AuthenticationFlowException;
import com.example.oidclogin.exception.AuthorizationException;
import com.example.oidclogin.exception.LoginTimeoutException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Short-lived loopback HTTP endpoint receiving the authorization redirect of one {@link AuthSession}.
 *
 * <p>Requests are served by a single background thread. The first request carrying either a
 * {@code code} with the session's {@code state}, or an {@code error}, completes a one-shot
 * {@link CompletableFuture}; the caller blocks on it with a deadline. Requests with another
 * {@code state} get a failure page and leave the session waiting.
 *
 * <p>The listening socket is closed by {@link #close()}, which {@link #await(Duration)} always
 * calls before returning, and which a JVM shutdown hook calls when the user interrupts the wait.
 */
@Slf4j
public class CallbackListener implements AutoCloseable {

  private static final String CONTENT_TYPE_HTML = "text/html; charset=utf-8";
  private static final int BACKLOG = 8;

  private final AuthSession session;
  private final int port;
  private final String callbackPath;
  private final CallbackPages pages;

  private final CompletableFuture<CallbackResult> result = new CompletableFuture<>();
  private final AtomicInteger rejectedRequests = new AtomicInteger();
  private final AtomicBoolean closed = new AtomicBoolean();
  private volatile boolean timedOut;

  private HttpServer server;
  private ExecutorService executor;
  private Thread shutdownHook;

  public CallbackListener(AuthSession session, int port, String callbackPath, CallbackPages pages) {
    this.session = session;
    this.port = port;
    this.callbackPath = callbackPath;
    this.pages = pages;
  }

  /**
   * Binds the loopback port and starts serving. Fails fast if the port is taken,
   * for instance by a listener left over from a crashed session.
   *
   * @throws AuthorizationException with {@link AuthorizationException#CALLBACK_UNAVAILABLE}
   */
  public CallbackListener start() {
    try {
      server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), port), BACKLOG);
    } catch (IOException e) {
      throw new AuthorizationException(AuthorizationException.CALLBACK_UNAVAILABLE,
          "Cannot listen for the login callback on port " + port + ": " + e.getMessage(), e);
    }

    executor = Executors.newSingleThreadExecutor(runnable -> {
      Thread thread = new Thread(runnable, "oidc-callback-" + port);
      thread.setDaemon(true);
      return thread;
    });
    server.setExecutor(executor);
    server.createContext(callbackPath, this::handle);
    server.start();

    shutdownHook = new Thread(this::close, "oidc-callback-shutdown-" + port);
    Runtime.getRuntime().addShutdownHook(shutdownHook);

    log.debug("Listening for login callback on http://localhost:{}{}", port, callbackPath);
    return this;
  }

  /**
   * Blocks until the listener accepts a terminating request or {@code timeout} elapses,
   * then closes the listener.
   *
   * @return the received code, when the provider redirected with one
   * @throws AuthorizationException if the provider redirected with an error, or only requests
   *     with a foreign {@code state} arrived before the deadline
   * @throws LoginTimeoutException if nothing arrived before the deadline
   */
  public CallbackResult await(Duration timeout) {
    try {
      CallbackResult callback = result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (!callback.isSuccess()) {
        String description = callback.errorDescription() == null ? "" : ": " + callback.errorDescription();
        throw new AuthorizationException(callback.error(),
            "Authorization failed with error '" + callback.error() + "'" + description);
      }
      return callback;

    } catch (TimeoutException e) {
      timedOut = true;
      if (rejectedRequests.get() > 0) {
        throw new AuthorizationException(AuthorizationException.STATE_MISMATCH,
            "Login callback received " + rejectedRequests.get()
                + " request(s) with a mismatched state and no valid response within " + timeout.toSeconds() + "s");
      }
      throw new LoginTimeoutException("No login callback received within " + timeout.toSeconds() + "s");

    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AuthenticationFlowException("Login was cancelled while waiting for the callback", e);

    } catch (ExecutionException e) {
      throw new AuthenticationFlowException("Login callback failed", e.getCause());

    } finally {
      close();
    }
  }

  public CallbackState state() {
    CallbackResult completed = result.getNow(null);
    if (completed != null) {
      return completed.state();
    }
    return timedOut ? CallbackState.TIMED_OUT : CallbackState.WAITING;
  }

  public int rejectedRequests() {
    return rejectedRequests.get();
  }

  /**
   * Stops the server and releases the port. Safe to call more than once and from any thread.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    if (server != null) {
      server.stop(0);
    }
    if (executor != null) {
      executor.shutdownNow();
    }
    removeShutdownHook();
    log.debug("Login callback listener on port {} closed", port);
  }

  private void removeShutdownHook() {
    if (shutdownHook == null || Thread.currentThread() == shutdownHook) {
      return;
    }
    try {
      Runtime.getRuntime().removeShutdownHook(shutdownHook);
    } catch (IllegalStateException e) {
      // JVM is already shutting down; the hook runs close() itself.
      log.trace("Shutdown in progress, hook left in place");
    }
  }

  private void handle(HttpExchange exchange) throws IOException {
    try {
      if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
        respond(exchange, 405, pages.failure("Unsupported request method."));
        return;
      }

      Map<String, String> params;
      try {
        params = parseQuery(exchange.getRequestURI().getRawQuery());
      } catch (IllegalArgumentException e) {
        respond(exchange, 400, pages.failure("Malformed login response."));
        return;
      }
      String code = params.get("code");
      String error = params.get("error");
      String state = params.get("state");

      if (result.isDone()) {
        respond(exchange, 400, pages.failure("This login attempt has already completed."));
        return;
      }

      boolean stateMatches = state != null && constantTimeEquals(state, session.state());

      if (error != null) {
        if (state != null && !stateMatches) {
          reject(exchange);
          return;
        }
        completeWith(exchange, CallbackResult.error(error, params.get("error_description")));
        return;
      }

      if (code == null) {
        respond(exchange, 400, pages.failure("The request did not contain an authorization code."));
        return;
      }

      if (!stateMatches) {
        reject(exchange);
        return;
      }

      completeWith(exchange, CallbackResult.code(code));

    } finally {
      exchange.close();
    }
  }

  // Handlers run on one thread, so the isDone() check in handle() cannot race with this.
  private void completeWith(HttpExchange exchange, CallbackResult callback) throws IOException {
    try {
      if (callback.isSuccess()) {
        log.debug("Authorization code received for {}", session);
        respond(exchange, 200, pages.success());
      } else {
        log.debug("Authorization error '{}' received for {}", callback.error(), session);
        String description = callback.errorDescription() != null ? callback.errorDescription() : callback.error();
        respond(exchange, 400, pages.failure("Error: " + description));
      }
    } finally {
      result.complete(callback);
    }
  }

  private void reject(HttpExchange exchange) throws IOException {
    int rejected = rejectedRequests.incrementAndGet();
    log.warn("Rejected login callback with mismatched state ({} so far)", rejected);
    respond(exchange, 400, pages.failure("The login response does not belong to this login attempt."));
  }

  private static void respond(HttpExchange exchange, int status, String html) throws IOException {
    byte[] body = html.getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().set("Content-Type", CONTENT_TYPE_HTML);
    exchange.getResponseHeaders().set("Cache-Control", "no-store");
    exchange.sendResponseHeaders(status, body.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(body);
    }
  }

  static Map<String, String> parseQuery(String rawQuery) {
    Map<String, String> params = new HashMap<>();
    if (rawQuery == null || rawQuery.isEmpty()) {
      return params;
    }
    for (String pair : rawQuery.split("&")) {
      if (pair.isEmpty()) {
        continue;
      }
      int separator = pair.indexOf('=');
      String name = separator < 0 ? pair : pair.substring(0, separator);
      String value = separator < 0 ? "" : pair.substring(separator + 1);
      params.putIfAbsent(
          URLDecoder.decode(name, StandardCharsets.UTF_8),
          URLDecoder.decode(value, StandardCharsets.UTF_8));
    }
    return params;
  }

  private static boolean constantTimeEquals(String a, String b) {
    return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
  }
}
