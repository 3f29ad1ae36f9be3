package kanban.reconcile;

import kanban.MutationError;

import java.util.Objects;

/**
 * One speculative change awaiting its server response.
 *
 * <p>State machine: {@code PENDING -> CONFIRMED} or {@code PENDING -> REJECTED}. Both end
 * states are final. Transitions are made by {@link SpeculativeView}.
 *
 * @param <T> entity type
 */
public final class PendingMutation<T> {

  public enum State {
    PENDING,
    CONFIRMED,
    REJECTED
  }

  private final long sequence;
  private final String entityId;
  private final T speculativeValue;
  private volatile State state = State.PENDING;
  private volatile T canonicalValue;
  private volatile MutationError error;

  PendingMutation(long sequence, String entityId, T speculativeValue) {
    this.sequence = sequence;
    this.entityId = Objects.requireNonNull(entityId, "entityId");
    this.speculativeValue = speculativeValue;
  }

  /** Issue order within the owning view. */
  public long sequence() {
    return sequence;
  }

  public String entityId() {
    return entityId;
  }

  /** The value shown while pending; {@code null} for a speculative removal. */
  public T speculativeValue() {
    return speculativeValue;
  }

  public State state() {
    return state;
  }

  public boolean isPending() {
    return state == State.PENDING;
  }

  /** The server's canonical value, once confirmed. */
  public T canonicalValue() {
    return canonicalValue;
  }

  /** The rejection reason, once rejected. */
  public MutationError error() {
    return error;
  }

  void confirm(T value) {
    this.canonicalValue = value;
    this.state = State.CONFIRMED;
  }

  void reject(MutationError rejection) {
    this.error = rejection;
    this.state = State.REJECTED;
  }

  @Override
  public String toString() {
    return "PendingMutation{" + sequence + ", " + entityId + ", " + state + "}";
  }
}
