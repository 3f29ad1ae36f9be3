package kanban.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Append-only card comment.
 */
public record Comment(String id, String cardId, String authorId, String body, Instant createdAt) {
  public Comment {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(cardId, "cardId");
    Objects.requireNonNull(authorId, "authorId");
    Objects.requireNonNull(body, "body");
    Objects.requireNonNull(createdAt, "createdAt");
  }
}
