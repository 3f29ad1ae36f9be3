package kanban;

import java.util.Objects;

/**
 * Verified caller identity handed over by the external auth provider.
 *
 * @param userId the authenticated user id
 * @param orgId  the user's organization, or {@code null} when the provider supplies none
 */
public record Principal(String userId, String orgId) {
  public Principal {
    Objects.requireNonNull(userId, "userId");
    if (userId.isBlank()) {
      throw new IllegalArgumentException("userId cannot be blank");
    }
  }

  public static Principal of(String userId) {
    return new Principal(userId, null);
  }
}
