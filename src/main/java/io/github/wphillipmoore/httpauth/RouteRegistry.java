package io.github.wphillipmoore.httpauth;

import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import java.util.Objects;

/** Something that attaches a handler to a path pattern, such as a server's context table. */
@FunctionalInterface
public interface RouteRegistry {

  /**
   * Registers {@code handler} for {@code pattern}.
   *
   * @param pattern the path pattern, in whatever syntax the underlying router uses
   * @param handler the handler to attach
   */
  void register(String pattern, HttpHandler handler);

  /**
   * Adapts an {@link HttpServer}: each registration creates a context with {@link
   * HttpServer#createContext(String, HttpHandler)}.
   *
   * @param server the server to register contexts on
   * @return a registry backed by the server
   */
  static RouteRegistry of(HttpServer server) {
    Objects.requireNonNull(server, "server");
    return (pattern, handler) -> server.createContext(pattern, handler);
  }
}
