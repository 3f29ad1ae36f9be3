package kanban;

/**
 * Raised when the backing store cannot be reached. Transient: the request may be
 * retried with backoff.
 */
public class StoreUnavailableException extends KanbanException {

  public StoreUnavailableException(String message, Throwable cause) {
    super(ErrorKind.STORE_UNAVAILABLE, message, cause);
  }
}
