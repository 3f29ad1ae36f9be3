package kanban.model;

import java.util.Objects;

/**
 * Persisted list row. Lists of a board are displayed in ascending {@code orderKey}.
 */
public record BoardList(
    String id,
    String boardId,
    String title,
    long orderKey,
    boolean archived
) {
  public BoardList {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(boardId, "boardId");
    Objects.requireNonNull(title, "title");
  }

  public BoardList withTitle(String newTitle) {
    return new BoardList(id, boardId, newTitle, orderKey, archived);
  }

  public BoardList withOrderKey(long newOrderKey) {
    return new BoardList(id, boardId, title, newOrderKey, archived);
  }

  public BoardList withArchived(boolean newArchived) {
    return new BoardList(id, boardId, title, orderKey, newArchived);
  }
}
