package kanban.order;

import java.util.Objects;

/**
 * Identifies one ordered collection: the lists of a board or the cards of a list.
 *
 * @param kind     which entity type the collection holds
 * @param parentId id of the owning board or list
 */
public record OrderedCollection(Kind kind, String parentId) {

  public enum Kind {
    /** Lists of the board {@code parentId}. */
    BOARD_LISTS,
    /** Cards of the list {@code parentId}. */
    LIST_CARDS
  }

  public OrderedCollection {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(parentId, "parentId");
  }

  public static OrderedCollection listsOf(String boardId) {
    return new OrderedCollection(Kind.BOARD_LISTS, boardId);
  }

  public static OrderedCollection cardsOf(String listId) {
    return new OrderedCollection(Kind.LIST_CARDS, listId);
  }
}
