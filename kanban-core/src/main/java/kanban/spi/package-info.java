/**
 * Service Provider Interfaces implemented by integrators.
 *
 * <p>{@link kanban.spi.BoardStore} persists entities and order keys,
 * {@link kanban.spi.TransactionRunner} supplies atomicity, {@link kanban.spi.TxContext}
 * exposes the running transaction, {@link kanban.spi.ConnectionProvider} hands out
 * connections and {@link kanban.spi.MetricsExporter} receives counters.
 *
 * @see kanban.spi.BoardStore
 * @see kanban.spi.TransactionRunner
 */
package kanban.spi;
