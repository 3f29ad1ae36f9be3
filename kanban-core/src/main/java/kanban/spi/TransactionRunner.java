package kanban.spi;

/**
 * Runs a unit of work as one isolated store transaction: all of its writes commit
 * together or none do.
 *
 * <p>Implementations translate store failures into engine errors: contention that
 * outlasts their retry budget becomes {@link kanban.ConflictException}, lost connectivity
 * becomes {@link kanban.StoreUnavailableException}. Any exception thrown by the work rolls
 * the transaction back and propagates unchanged.
 *
 * <p>Implementations may run {@code work} more than once when the store aborts a
 * transaction for serialization reasons, so work must not have side effects outside
 * the transaction other than those registered through {@link TxContext#afterCommit}.
 */
public interface TransactionRunner {

  /**
   * Executes {@code work} in a new transaction and commits it.
   *
   * @param work the unit of work; receives the active transaction context
   * @param <T>  result type
   * @return the work's result
   */
  <T> T inTransaction(TransactionalWork<T> work);

  /**
   * Body of a transaction.
   */
  @FunctionalInterface
  interface TransactionalWork<T> {
    T execute(TxContext tx);
  }
}
