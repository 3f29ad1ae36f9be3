package kanban;

/**
 * Raised when a board, list, card, label or membership does not exist.
 */
public class NotFoundException extends KanbanException {

  public NotFoundException(String message) {
    super(ErrorKind.NOT_FOUND, message);
  }

  public static NotFoundException board(String boardId) {
    return new NotFoundException("Board not found: " + boardId);
  }

  public static NotFoundException list(String listId) {
    return new NotFoundException("List not found: " + listId);
  }

  public static NotFoundException card(String cardId) {
    return new NotFoundException("Card not found: " + cardId);
  }

  public static NotFoundException label(String labelId) {
    return new NotFoundException("Label not found: " + labelId);
  }

  public static NotFoundException member(String boardId, String userId) {
    return new NotFoundException("User " + userId + " is not a member of board " + boardId);
  }
}
