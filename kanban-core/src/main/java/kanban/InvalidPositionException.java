package kanban;

/**
 * Raised when a position anchor is missing, is the moved item itself, or belongs to a
 * different collection than the target.
 */
public class InvalidPositionException extends KanbanException {

  public InvalidPositionException(String message) {
    super(ErrorKind.INVALID_POSITION, message);
  }
}
