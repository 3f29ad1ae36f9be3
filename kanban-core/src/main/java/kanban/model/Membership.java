package kanban.model;

import java.util.Objects;

/**
 * The {@code (board, user, role)} association. At most one per {@code (boardId, userId)}.
 */
public record Membership(String boardId, String userId, Role role) {
  public Membership {
    Objects.requireNonNull(boardId, "boardId");
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(role, "role");
  }

  public Membership withRole(Role newRole) {
    return new Membership(boardId, userId, newRole);
  }
}
