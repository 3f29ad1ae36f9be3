package kanban;

import java.util.Objects;

/**
 * Base type of every failure the mutation engine reports.
 *
 * <p>Unchecked, so store and engine code can propagate it without wrapping. The
 * {@link #kind()} is what clients switch on; the message is meant for display.
 *
 * @see KanbanClient
 */
public abstract class KanbanException extends RuntimeException {

  private final ErrorKind kind;

  protected KanbanException(ErrorKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  protected KanbanException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public ErrorKind kind() {
    return kind;
  }

  /**
   * Converts this exception into the error value carried by {@link MutationResult.Rejected}.
   */
  public MutationError toError() {
    return new MutationError(kind, getMessage());
  }
}
