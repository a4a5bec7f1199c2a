package io.github.wphillipmoore.httpauth.exception;

/**
 * Thrown by a {@link io.github.wphillipmoore.httpauth.RequestSigner} that cannot attach credentials
 * to a request. The request is abandoned before it is sent.
 */
public final class SigningException extends HttpAuthException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a signing exception.
   *
   * @param message description of the failure
   */
  public SigningException(String message) {
    super(message);
  }

  /**
   * Creates a signing exception with a cause.
   *
   * @param message description of the failure
   * @param cause the underlying cause
   */
  public SigningException(String message, Throwable cause) {
    super(message, cause);
  }
}
