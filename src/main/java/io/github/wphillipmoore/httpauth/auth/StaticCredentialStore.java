package io.github.wphillipmoore.httpauth.auth;

import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * A {@link CredentialChecker} backed by an in-memory map of username to password.
 *
 * <p>The map is referenced, not copied, so changes made by its owner are seen by the next check. A
 * store that is checked from several request threads while its owner edits the map needs a
 * concurrent map, or the owner can swap in a new store instead. A {@code null} map behaves like an
 * empty one and rejects every pair.
 */
public final class StaticCredentialStore implements CredentialChecker {

  private final @Nullable Map<String, String> credentials;

  /**
   * Creates a store over the given username to password map.
   *
   * @param credentials the map to consult, or {@code null} for a store that rejects everything
   */
  public StaticCredentialStore(@Nullable Map<String, String> credentials) {
    this.credentials = credentials;
  }

  /**
   * Returns {@code true} if the map holds {@code username} with a value exactly equal to {@code
   * password}. Comparison is case-sensitive and does not trim.
   */
  @Override
  public boolean check(String username, String password) {
    if (credentials == null) {
      return false;
    }
    String expected = credentials.get(username);
    return expected != null && expected.equals(password);
  }
}
