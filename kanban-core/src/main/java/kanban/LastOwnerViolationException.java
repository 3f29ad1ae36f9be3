package kanban;

/**
 * Raised when a membership change would leave a board without any owner.
 */
public class LastOwnerViolationException extends KanbanException {

  public LastOwnerViolationException(String boardId) {
    super(ErrorKind.LAST_OWNER_VIOLATION, "Board " + boardId + " must keep at least one owner");
  }
}
