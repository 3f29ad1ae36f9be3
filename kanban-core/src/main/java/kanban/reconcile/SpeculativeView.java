package kanban.reconcile;

import kanban.ErrorKind;
import kanban.MutationError;
import kanban.MutationResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Client-side view of entities that shows speculative changes before the server
 * confirms them.
 *
 * <p>The view keeps, per entity id, the last confirmed value plus the still pending
 * speculative values in issue order. The visible value is the confirmed value with every
 * pending value for the same id applied on top; the newest pending value wins.
 *
 * <ul>
 *   <li>{@link #apply} records a speculative value and returns its {@link PendingMutation}.</li>
 *   <li>{@link #resolve} applies a server response. Responses are applied in arrival order,
 *       so a confirmation that arrives later overrides one that arrived earlier,
 *       whatever order the mutations were issued in.</li>
 *   <li>A rejection drops only the rejected speculative value: the entity falls back to
 *       its confirmed value with the remaining pending values re-applied.</li>
 * </ul>
 *
 * <p>A {@code null} value means the entity is absent (deleted, or speculatively removed).
 * All methods are thread-safe.
 *
 * @param <T> entity type
 */
public final class SpeculativeView<T> {
  private static final Logger logger = Logger.getLogger(SpeculativeView.class.getName());

  private final Map<String, T> confirmed = new HashMap<>();
  private final List<PendingMutation<T>> pending = new ArrayList<>();
  private long nextSequence = 1;

  /**
   * Seeds or replaces the confirmed value of an entity, e.g. from a fresh read.
   */
  public synchronized void load(String entityId, T value) {
    Objects.requireNonNull(entityId, "entityId");
    if (value == null) {
      confirmed.remove(entityId);
    } else {
      confirmed.put(entityId, value);
    }
  }

  /**
   * Shows {@code speculativeValue} immediately and tracks it until resolved.
   *
   * @param speculativeValue the expected new state, or {@code null} for a removal
   */
  public synchronized PendingMutation<T> apply(String entityId, T speculativeValue) {
    PendingMutation<T> mutation = new PendingMutation<>(nextSequence++, entityId, speculativeValue);
    pending.add(mutation);
    return mutation;
  }

  /**
   * Applies the server response for {@code mutation}.
   *
   * <p>{@code Confirmed} replaces the entity's confirmed value with the canonical value.
   * {@code Rejected} discards the speculative value. A response for a mutation that is no
   * longer pending, e.g. one that arrives after {@link #timeout}, is ignored.
   *
   * @return {@code true} if the response was applied
   */
  public synchronized boolean resolve(PendingMutation<T> mutation, MutationResult<? extends T> result) {
    Objects.requireNonNull(mutation, "mutation");
    Objects.requireNonNull(result, "result");
    if (!mutation.isPending() || !pending.remove(mutation)) {
      logger.log(Level.FINE, "Ignoring response for resolved mutation {0}", mutation);
      return false;
    }
    if (result.isConfirmed()) {
      T value = result.orElseThrow();
      load(mutation.entityId(), value);
      mutation.confirm(value);
    } else {
      MutationError error = ((MutationResult.Rejected<?>) result).error();
      mutation.reject(error);
      logger.log(Level.FINE, "Rolled back {0}: {1}", new Object[] {mutation, error});
    }
    return true;
  }

  /**
   * Resolves {@code mutation} as {@code Rejected(TIMEOUT)}. A response arriving later is ignored.
   */
  public boolean timeout(PendingMutation<T> mutation) {
    return resolve(mutation, MutationResult.rejected(ErrorKind.TIMEOUT,
        "No response for " + mutation.entityId()));
  }

  /**
   * Returns the value the user should see: the confirmed value with pending values on top.
   */
  public synchronized Optional<T> visible(String entityId) {
    T value = confirmed.get(entityId);
    for (PendingMutation<T> mutation : pending) {
      if (mutation.entityId().equals(entityId)) {
        value = mutation.speculativeValue();
      }
    }
    return Optional.ofNullable(value);
  }

  public synchronized Optional<T> confirmed(String entityId) {
    return Optional.ofNullable(confirmed.get(entityId));
  }

  /**
   * Returns the visible value of every entity that has one.
   */
  public synchronized Map<String, T> snapshot() {
    Set<String> ids = new LinkedHashSet<>(confirmed.keySet());
    for (PendingMutation<T> mutation : pending) {
      ids.add(mutation.entityId());
    }
    Map<String, T> result = new HashMap<>();
    for (String id : ids) {
      visible(id).ifPresent(value -> result.put(id, value));
    }
    return Collections.unmodifiableMap(result);
  }

  /**
   * Returns the unresolved mutations in issue order.
   */
  public synchronized List<PendingMutation<T>> pending() {
    return List.copyOf(pending);
  }

  public synchronized boolean hasPending(String entityId) {
    for (PendingMutation<T> mutation : pending) {
      if (mutation.entityId().equals(entityId)) {
        return true;
      }
    }
    return false;
  }
}
