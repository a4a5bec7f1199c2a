package io.github.wphillipmoore.httpauth;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import io.github.wphillipmoore.httpauth.auth.BasicCredentials;
import io.github.wphillipmoore.httpauth.auth.CredentialChecker;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An {@link HttpHandler} that requires valid Basic credentials before passing an exchange on.
 *
 * <p>Each request's {@code Authorization} header is decoded and handed to the {@link
 * CredentialChecker}. A missing or malformed header is presented as an empty username and password.
 * If the checker accepts, the untouched exchange goes to the downstream handler, which owns the
 * response from then on. Otherwise the exchange is answered here with {@code 401 Unauthorized}, a
 * {@code WWW-Authenticate: Basic} challenge and the body {@code Unauthorized}, and the downstream
 * handler is not called.
 *
 * <p>The handler holds no mutable state and may serve concurrent exchanges.
 */
public final class AuthenticatingHandler implements HttpHandler {

  static final int STATUS_UNAUTHORIZED = 401;
  static final String UNAUTHORIZED_TEXT = "Unauthorized";
  static final String CHALLENGE_HEADER = "WWW-Authenticate";
  static final String CHALLENGE = "Basic";

  private static final Logger LOG = LoggerFactory.getLogger(AuthenticatingHandler.class);
  private static final byte[] UNAUTHORIZED_BODY =
      UNAUTHORIZED_TEXT.getBytes(StandardCharsets.UTF_8);

  private final CredentialChecker checker;
  private final HttpHandler downstream;

  /**
   * Creates a handler guarding {@code downstream} with {@code checker}.
   *
   * @param checker the checker consulted for every exchange
   * @param downstream the handler invoked for accepted exchanges
   */
  public AuthenticatingHandler(CredentialChecker checker, HttpHandler downstream) {
    this.checker = Objects.requireNonNull(checker, "checker");
    this.downstream = Objects.requireNonNull(downstream, "downstream");
  }

  /**
   * Creates a handler guarding a function with {@code checker}.
   *
   * @param checker the checker consulted for every exchange
   * @param function the function invoked for accepted exchanges
   * @return the guarding handler
   */
  public static AuthenticatingHandler of(CredentialChecker checker, ExchangeFunction function) {
    Objects.requireNonNull(function, "function");
    return new AuthenticatingHandler(checker, function.asHandler());
  }

  @Override
  public void handle(HttpExchange exchange) throws IOException {
    BasicCredentials credentials =
        BasicCredentials.fromAuthorizationHeader(
                exchange.getRequestHeaders().getFirst(BasicCredentials.AUTHORIZATION_HEADER))
            .orElse(BasicCredentials.EMPTY);
    if (!checker.check(credentials.username(), credentials.password())) {
      reject(exchange);
      return;
    }
    downstream.handle(exchange);
  }

  private static void reject(HttpExchange exchange) throws IOException {
    LOG.debug(
        "Rejected {} {}: missing or invalid credentials",
        exchange.getRequestMethod(),
        exchange.getRequestURI());
    exchange.getResponseHeaders().add(CHALLENGE_HEADER, CHALLENGE);
    exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
    try {
      if ("HEAD".equalsIgnoreCase(exchange.getRequestMethod())) {
        exchange.sendResponseHeaders(STATUS_UNAUTHORIZED, -1);
        return;
      }
      exchange.sendResponseHeaders(STATUS_UNAUTHORIZED, UNAUTHORIZED_BODY.length);
      OutputStream body = exchange.getResponseBody();
      body.write(UNAUTHORIZED_BODY);
    } finally {
      exchange.close();
    }
  }
}
