package kanban.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Persisted board row.
 *
 * @param id         ULID
 * @param title      display title
 * @param visibility read access for non-members
 * @param ownerId    the user recorded as owner; always holds an OWNER membership
 * @param orgId      organization the board belongs to, or {@code null}
 * @param archived   archived boards are read-only until restored
 * @param createdAt  creation time
 */
public record Board(
    String id,
    String title,
    Visibility visibility,
    String ownerId,
    String orgId,
    boolean archived,
    Instant createdAt
) {
  public Board {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(title, "title");
    Objects.requireNonNull(visibility, "visibility");
    Objects.requireNonNull(ownerId, "ownerId");
    Objects.requireNonNull(createdAt, "createdAt");
  }

  public Board withTitle(String newTitle) {
    return new Board(id, newTitle, visibility, ownerId, orgId, archived, createdAt);
  }

  public Board withArchived(boolean newArchived) {
    return new Board(id, title, visibility, ownerId, orgId, newArchived, createdAt);
  }

  public Board withOwnerId(String newOwnerId) {
    return new Board(id, title, visibility, newOwnerId, orgId, archived, createdAt);
  }
}
