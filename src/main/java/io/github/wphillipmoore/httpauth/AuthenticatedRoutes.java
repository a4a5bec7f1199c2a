package io.github.wphillipmoore.httpauth;

import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.github.wphillipmoore.httpauth.auth.CredentialChecker;
import java.util.Objects;

/**
 * Registers routes that are all guarded by the same {@link CredentialChecker}.
 *
 * <p>Every handler or function registered here is wrapped in an {@link AuthenticatingHandler}
 * before it reaches the underlying {@link RouteRegistry}:
 *
 * <pre>{@code
 * HttpServer server = HttpServer.create(new InetSocketAddress(8080), 0);
 * AuthenticatedRoutes routes =
 *     new AuthenticatedRoutes(new StaticCredentialStore(Map.of("admin", "secret")), server);
 * routes.handleFunc("/status", exchange -> ...);
 * routes.handle("/reports", reportHandler);
 * server.start();
 * }</pre>
 */
public final class AuthenticatedRoutes {

  private final CredentialChecker checker;
  private final RouteRegistry registry;

  /**
   * Creates a wrapper over an arbitrary registry.
   *
   * @param checker the checker applied to every route
   * @param registry the registry routes are attached to
   */
  public AuthenticatedRoutes(CredentialChecker checker, RouteRegistry registry) {
    this.checker = Objects.requireNonNull(checker, "checker");
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  /**
   * Creates a wrapper that registers contexts on an {@link HttpServer}.
   *
   * @param checker the checker applied to every route
   * @param server the server routes are attached to
   */
  public AuthenticatedRoutes(CredentialChecker checker, HttpServer server) {
    this(checker, RouteRegistry.of(server));
  }

  /** Returns the checker applied to every route. */
  public CredentialChecker getChecker() {
    return checker;
  }

  /**
   * Registers a guarded handler.
   *
   * @param pattern the path pattern
   * @param handler the handler invoked for accepted requests
   */
  public void handle(String pattern, HttpHandler handler) {
    register(checker, registry, pattern, handler);
  }

  /**
   * Registers a guarded function.
   *
   * @param pattern the path pattern
   * @param function the function invoked for accepted requests
   */
  public void handleFunc(String pattern, ExchangeFunction function) {
    registerFunction(checker, registry, pattern, function);
  }

  /**
   * Registers a single guarded handler on {@code registry}.
   *
   * @param checker the checker guarding the route
   * @param registry the registry to attach to
   * @param pattern the path pattern
   * @param handler the handler invoked for accepted requests
   */
  public static void register(
      CredentialChecker checker, RouteRegistry registry, String pattern, HttpHandler handler) {
    Objects.requireNonNull(pattern, "pattern");
    registry.register(pattern, new AuthenticatingHandler(checker, handler));
  }

  /**
   * Registers a single guarded function on {@code registry}.
   *
   * @param checker the checker guarding the route
   * @param registry the registry to attach to
   * @param pattern the path pattern
   * @param function the function invoked for accepted requests
   */
  public static void registerFunction(
      CredentialChecker checker,
      RouteRegistry registry,
      String pattern,
      ExchangeFunction function) {
    Objects.requireNonNull(pattern, "pattern");
    registry.register(pattern, AuthenticatingHandler.of(checker, function));
  }
}
