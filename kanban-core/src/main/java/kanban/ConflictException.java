package kanban;

/**
 * Raised when concurrent writers kept the transaction from completing within its retry
 * budget, or when order keys stayed exhausted after a rebalance.
 */
public class ConflictException extends KanbanException {

  public ConflictException(String message) {
    super(ErrorKind.CONFLICT, message);
  }

  public ConflictException(String message, Throwable cause) {
    super(ErrorKind.CONFLICT, message, cause);
  }
}
