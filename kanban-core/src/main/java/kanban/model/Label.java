package kanban.model;

import java.util.Objects;

/**
 * Board-scoped label. {@code color} is a {@code #RRGGBB} string.
 */
public record Label(String id, String boardId, String name, String color) {
  public Label {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(boardId, "boardId");
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(color, "color");
  }
}
