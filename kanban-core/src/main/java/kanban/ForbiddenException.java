package kanban;

/**
 * Raised when the authorization guard denies an action. The message is the denial reason.
 */
public class ForbiddenException extends KanbanException {

  public ForbiddenException(String reason) {
    super(ErrorKind.FORBIDDEN, reason);
  }
}
