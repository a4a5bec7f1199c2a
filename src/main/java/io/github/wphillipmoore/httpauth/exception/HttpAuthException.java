package io.github.wphillipmoore.httpauth.exception;

/**
 * Base exception for errors raised by the client side of this library.
 *
 * <p>This is an unchecked exception hierarchy. A rejected login on the server side is not an
 * exception: it is answered with a 401 response.
 */
public sealed class HttpAuthException extends RuntimeException
    permits SigningException, HttpAuthTransportException {

  /** Creates an exception with the given message. */
  public HttpAuthException(String message) {
    super(message);
  }

  /** Creates an exception with the given message and cause. */
  public HttpAuthException(String message, Throwable cause) {
    super(message, cause);
  }
}
