package kanban.spi;

import kanban.ErrorKind;

/**
 * Observability hook for exporting mutation counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Counts a committed mutation.
   *
   * @param operation engine operation name, e.g. {@code "moveCard"}
   */
  void incrementCommitted(String operation);

  /**
   * Counts a mutation handed back to the client as rejected.
   */
  void incrementRejected(ErrorKind kind);

  /**
   * Counts a committed rebalance of one collection.
   */
  void incrementRebalance();

  /**
   * Counts a transaction restarted after a serialization failure or deadlock.
   */
  default void incrementTransactionRetry() {
  }

  /**
   * Records the wall time of one engine operation, successful or not.
   */
  default void recordMutationLatencyMs(String operation, long latencyMs) {
  }

  final class Noop implements MetricsExporter {
    @Override
    public void incrementCommitted(String operation) {
    }

    @Override
    public void incrementRejected(ErrorKind kind) {
    }

    @Override
    public void incrementRebalance() {
    }
  }
}
