package io.github.wphillipmoore.httpauth.auth;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * A username and password pair carried in an {@code Authorization: Basic} header.
 *
 * <p>Both values are opaque: no trimming, case folding or other canonicalization is applied. The
 * username must not contain a colon for the header form to round-trip; the password may.
 *
 * @param username the username, never null
 * @param password the password, never null
 */
public record BasicCredentials(String username, String password) {

  /** Name of the request header that carries credentials. */
  public static final String AUTHORIZATION_HEADER = "Authorization";

  /** Credentials presented to a checker when a request carries none. */
  public static final BasicCredentials EMPTY = new BasicCredentials("", "");

  private static final String PREFIX = "Basic ";

  /** Validates that username and password are non-null. */
  public BasicCredentials {
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(password, "password");
  }

  /**
   * Encodes these credentials as an {@code Authorization} header value.
   *
   * @return {@code "Basic "} followed by the base64 encoding of {@code username:password}
   */
  public String toAuthorizationHeader() {
    String pair = username + ":" + password;
    return PREFIX + Base64.getEncoder().encodeToString(pair.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Decodes an {@code Authorization} header value.
   *
   * <p>The scheme token is matched case-insensitively and must be followed by a single space. The
   * remainder must be padded standard base64 of valid UTF-8. The decoded text is split at the first
   * colon, so a password may contain colons and a username may be empty.
   *
   * @param headerValue the raw header value, or {@code null} if the header is absent
   * @return the decoded credentials, or empty if the value is absent or malformed
   */
  public static Optional<BasicCredentials> fromAuthorizationHeader(@Nullable String headerValue) {
    if (headerValue == null
        || headerValue.length() < PREFIX.length()
        || !headerValue.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) {
      return Optional.empty();
    }
    String encoded = headerValue.substring(PREFIX.length());
    // The JDK decoder tolerates missing padding; a Basic header must be padded.
    if (encoded.length() % 4 != 0) {
      return Optional.empty();
    }
    byte[] bytes;
    try {
      bytes = Base64.getDecoder().decode(encoded);
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
    // Malformed UTF-8 is refused rather than replaced, so distinct byte sequences stay distinct.
    String decoded;
    try {
      decoded =
          StandardCharsets.UTF_8
              .newDecoder()
              .onMalformedInput(CodingErrorAction.REPORT)
              .onUnmappableCharacter(CodingErrorAction.REPORT)
              .decode(ByteBuffer.wrap(bytes))
              .toString();
    } catch (CharacterCodingException e) {
      return Optional.empty();
    }
    int colon = decoded.indexOf(':');
    if (colon < 0) {
      return Optional.empty();
    }
    return Optional.of(
        new BasicCredentials(decoded.substring(0, colon), decoded.substring(colon + 1)));
  }
}
