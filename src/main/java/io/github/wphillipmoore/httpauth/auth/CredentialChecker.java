package io.github.wphillipmoore.httpauth.auth;

/**
 * Decides whether a username and password pair is valid.
 *
 * <p>Implementations must be total: every pair of non-null strings, including empty strings,
 * yields a result. An unknown or wrong pair is a {@code false} result, never an exception.
 * Implementations should have no side effects, so that repeated calls against unchanged state give
 * the same answer.
 *
 * <p>Any storage backend can be plugged in by implementing this interface. A lambda is enough for a
 * fixed answer:
 *
 * <pre>{@code
 * CredentialChecker denyAll = (username, password) -> false;
 * }</pre>
 */
@FunctionalInterface
public interface CredentialChecker {

  /**
   * Checks a username and password pair.
   *
   * @param username the presented username, possibly empty
   * @param password the presented password, possibly empty
   * @return {@code true} if and only if the pair is valid
   */
  boolean check(String username, String password);
}
