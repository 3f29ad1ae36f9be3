package kanban.model;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Set;

/**
 * Persisted card row. Cards of a list are displayed in ascending {@code orderKey}.
 *
 * <p>{@code boardId} is the board of the owning list, kept on the card so label
 * scoping and authorization need no extra join.
 */
public record Card(
    String id,
    String listId,
    String boardId,
    String title,
    String description,
    long orderKey,
    LocalDate dueDate,
    Set<String> labelIds,
    boolean archived
) {
  public Card {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(listId, "listId");
    Objects.requireNonNull(boardId, "boardId");
    Objects.requireNonNull(title, "title");
    labelIds = labelIds == null ? Set.of() : Set.copyOf(labelIds);
  }

  public Card withTitle(String newTitle) {
    return new Card(id, listId, boardId, newTitle, description, orderKey, dueDate, labelIds, archived);
  }

  public Card withDetails(String newDescription, LocalDate newDueDate) {
    return new Card(id, listId, boardId, title, newDescription, orderKey, newDueDate, labelIds, archived);
  }

  public Card withPlacement(String newListId, long newOrderKey) {
    return new Card(id, newListId, boardId, title, description, newOrderKey, dueDate, labelIds, archived);
  }

  public Card withLabelIds(Set<String> newLabelIds) {
    return new Card(id, listId, boardId, title, description, orderKey, dueDate, newLabelIds, archived);
  }

  public Card withArchived(boolean newArchived) {
    return new Card(id, listId, boardId, title, description, orderKey, dueDate, labelIds, newArchived);
  }
}
