package io.github.wphillipmoore.httpauth;

import java.net.http.HttpRequest;

/**
 * Attaches credentials to an outbound request before it is sent.
 *
 * <p>Implementations that depend on something that can fail, such as fetching a token, throw
 * {@link io.github.wphillipmoore.httpauth.exception.SigningException}; the request is then not
 * sent.
 */
@FunctionalInterface
public interface RequestSigner {

  /**
   * Signs a request under construction.
   *
   * @param request the builder of the request to sign
   * @throws io.github.wphillipmoore.httpauth.exception.SigningException if the request cannot be
   *     signed
   */
  void sign(HttpRequest.Builder request);
}
