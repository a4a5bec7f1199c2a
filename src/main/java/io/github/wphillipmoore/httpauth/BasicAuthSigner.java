package io.github.wphillipmoore.httpauth;

import io.github.wphillipmoore.httpauth.auth.BasicCredentials;
import java.net.http.HttpRequest;
import java.util.Objects;

/**
 * A {@link RequestSigner} that sets an {@code Authorization: Basic} header.
 *
 * @param credentials the credentials attached to every request, never null
 */
public record BasicAuthSigner(BasicCredentials credentials) implements RequestSigner {

  /** Validates that credentials are non-null. */
  public BasicAuthSigner {
    Objects.requireNonNull(credentials, "credentials");
  }

  /**
   * Creates a signer for a username and password.
   *
   * @param username the username, never null
   * @param password the password, never null
   */
  public BasicAuthSigner(String username, String password) {
    this(new BasicCredentials(username, password));
  }

  /** Replaces any existing {@code Authorization} header; never fails. */
  @Override
  public void sign(HttpRequest.Builder request) {
    request.setHeader(
        BasicCredentials.AUTHORIZATION_HEADER, credentials.toAuthorizationHeader());
  }
}
