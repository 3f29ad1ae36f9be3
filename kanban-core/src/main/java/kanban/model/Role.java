package kanban.model;

import java.util.Locale;

/**
 * Board-scoped role. Roles form a strict capability ladder: every action an
 * {@link #ADMIN} may perform a {@link #OWNER} may perform too, and so on down.
 */
public enum Role {
  MEMBER(1),
  ADMIN(2),
  OWNER(3);

  private final int rank;

  Role(int rank) {
    this.rank = rank;
  }

  /**
   * Returns {@code true} if this role grants at least the capabilities of {@code required}.
   */
  public boolean atLeast(Role required) {
    return rank >= required.rank;
  }

  /**
   * Persisted form, lower case.
   */
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Role fromCode(String code) {
    return Role.valueOf(code.toUpperCase(Locale.ROOT));
  }
}
