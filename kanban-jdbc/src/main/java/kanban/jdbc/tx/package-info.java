/**
 * Manual JDBC transaction management.
 *
 * <p>{@link kanban.jdbc.tx.JdbcTransactionRunner} implements the engine's
 * {@link kanban.spi.TransactionRunner} with retry of serialization failures and
 * translation of store errors. It is built on {@link kanban.jdbc.tx.JdbcTransactionManager},
 * a try-with-resources API that binds connections to a
 * {@link kanban.jdbc.tx.ThreadLocalTxContext}.
 *
 * @see kanban.jdbc.tx.JdbcTransactionRunner
 * @see kanban.jdbc.tx.JdbcTransactionManager
 */
package kanban.jdbc.tx;
