package io.github.wphillipmoore.httpauth;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import java.io.IOException;

/**
 * A request-handling function, typically a lambda or method reference.
 *
 * <p>Used by the function-form registration methods; {@link #asHandler()} adapts it to an {@link
 * HttpHandler} so both forms are guarded the same way.
 */
@FunctionalInterface
public interface ExchangeFunction {

  /**
   * Serves one exchange.
   *
   * @param exchange the exchange to serve
   * @throws IOException if the response cannot be written
   */
  void serve(HttpExchange exchange) throws IOException;

  /** Returns an {@link HttpHandler} that delegates to this function. */
  default HttpHandler asHandler() {
    return this::serve;
  }
}
