package kanban;

import java.util.Objects;
import java.util.function.Function;

/**
 * Tagged outcome of a mutation, as consumed by the optimistic reconciliation contract.
 *
 * <ul>
 *   <li>{@link Confirmed}: the mutation committed; {@code value} is the canonical state,
 *       including the order key the server allocated.</li>
 *   <li>{@link Rejected}: nothing was persisted; the client must restore its last
 *       confirmed state.</li>
 * </ul>
 *
 * @param <T> type of the canonical entity
 * @see kanban.reconcile.SpeculativeView
 */
public sealed interface MutationResult<T> permits MutationResult.Confirmed, MutationResult.Rejected {

  static <T> Confirmed<T> confirmed(T value) {
    return new Confirmed<>(value);
  }

  static <T> Rejected<T> rejected(MutationError error) {
    return new Rejected<>(error);
  }

  static <T> Rejected<T> rejected(ErrorKind kind, String message) {
    return new Rejected<>(new MutationError(kind, message));
  }

  default boolean isConfirmed() {
    return this instanceof Confirmed;
  }

  /**
   * Returns the confirmed value or throws if the mutation was rejected.
   *
   * @throws IllegalStateException if this result is {@link Rejected}
   */
  default T orElseThrow() {
    if (this instanceof Confirmed<T> confirmed) {
      return confirmed.value();
    }
    MutationError error = ((Rejected<T>) this).error();
    throw new IllegalStateException(error.kind() + ": " + error.message());
  }

  default <R> MutationResult<R> map(Function<? super T, ? extends R> mapper) {
    if (this instanceof Confirmed<T> confirmed) {
      return new Confirmed<>(mapper.apply(confirmed.value()));
    }
    return new Rejected<>(((Rejected<T>) this).error());
  }

  /**
   * Mutation committed.
   *
   * @param value canonical state after commit; {@code null} for deletions
   */
  record Confirmed<T>(T value) implements MutationResult<T> {
  }

  /**
   * Mutation not applied.
   *
   * @param error why it was rejected
   */
  record Rejected<T>(MutationError error) implements MutationResult<T> {
    public Rejected {
      Objects.requireNonNull(error, "error");
    }
  }
}
