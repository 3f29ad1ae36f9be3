package kanban;

import java.util.Objects;

/**
 * Error half of a {@link MutationResult}: the failure kind plus a human-readable reason.
 *
 * @param kind    failure category
 * @param message reason suitable for display (never {@code null})
 */
public record MutationError(ErrorKind kind, String message) {
  public MutationError {
    Objects.requireNonNull(kind, "kind");
    message = message == null ? kind.name() : message;
  }
}
