package kanban;

/**
 * Raised for malformed mutation input, such as a blank title or a bad label color.
 */
public class InvalidArgumentException extends KanbanException {

  public InvalidArgumentException(String message) {
    super(ErrorKind.INVALID_ARGUMENT, message);
  }
}
