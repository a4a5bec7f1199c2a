package io.github.wphillipmoore.httpauth.auth;

/**
 * A {@link CredentialChecker} that accepts every pair, including empty ones.
 *
 * <p>Swapping this in turns authentication off without changing how routes are wired.
 */
public final class AllowAllChecker implements CredentialChecker {

  @Override
  public boolean check(String username, String password) {
    return true;
  }
}
