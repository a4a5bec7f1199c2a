package io.github.wphillipmoore.httpauth.exception;

import java.net.URI;
import java.util.Objects;

/** Thrown when a signed request fails at the network level. */
public final class HttpAuthTransportException extends HttpAuthException {

  private static final long serialVersionUID = 1L;

  private final URI uri;

  /**
   * Creates a transport exception with a cause.
   *
   * @param message description of the failure
   * @param uri the URI that was being accessed
   * @param cause the underlying cause
   */
  public HttpAuthTransportException(String message, URI uri, Throwable cause) {
    super(message, cause);
    this.uri = Objects.requireNonNull(uri, "uri");
  }

  /** Returns the URI that was being accessed when the failure occurred. */
  public URI getUri() {
    return uri;
  }
}
