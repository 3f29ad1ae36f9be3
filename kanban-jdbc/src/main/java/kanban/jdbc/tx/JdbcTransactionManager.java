package kanban.jdbc.tx;

import kanban.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lightweight transaction manager for manual JDBC usage. Obtains a connection, disables
 * auto-commit, applies the configured isolation level and binds the connection to a
 * {@link ThreadLocalTxContext}.
 *
 * <p>Use via try-with-resources on the returned {@link Transaction}:
 * <pre>{@code
 * try (var tx = txManager.begin()) {
 *     store.insertBoard(txContext.currentConnection(), board);
 *     tx.commit();
 * }
 * }</pre>
 *
 * <p>Most callers go through {@link JdbcTransactionRunner} instead.
 *
 * @see ThreadLocalTxContext
 */
public final class JdbcTransactionManager {
  private static final Logger logger = Logger.getLogger(JdbcTransactionManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final ThreadLocalTxContext txContext;
  private final int isolationLevel;

  public JdbcTransactionManager(ConnectionProvider connectionProvider, ThreadLocalTxContext txContext) {
    this(connectionProvider, txContext, Connection.TRANSACTION_READ_COMMITTED);
  }

  /**
   * @param isolationLevel one of the {@code Connection.TRANSACTION_*} constants
   */
  public JdbcTransactionManager(ConnectionProvider connectionProvider, ThreadLocalTxContext txContext,
      int isolationLevel) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.txContext = Objects.requireNonNull(txContext, "txContext");
    this.isolationLevel = IsolationLevels.validate(isolationLevel);
  }

  public ThreadLocalTxContext txContext() {
    return txContext;
  }

  public int isolationLevel() {
    return isolationLevel;
  }

  /**
   * Begins a new transaction by obtaining a connection and binding it to the thread context.
   *
   * @return a new {@link Transaction} handle (use with try-with-resources)
   * @throws SQLException if a connection cannot be obtained or configured
   * @throws IllegalStateException if a transaction is already bound to this thread
   */
  public Transaction begin() throws SQLException {
    Connection connection = connectionProvider.getConnection();
    int previousIsolation;
    try {
      previousIsolation = connection.getTransactionIsolation();
      if (previousIsolation != isolationLevel) {
        connection.setTransactionIsolation(isolationLevel);
      }
      connection.setAutoCommit(false);
      txContext.bind(connection);
    } catch (SQLException | RuntimeException e) {
      closeQuietly(connection, e);
      throw e;
    }
    return new Transaction(connection, txContext, previousIsolation);
  }

  private static void closeQuietly(Connection connection, Exception primary) {
    try {
      connection.close();
    } catch (SQLException e) {
      primary.addSuppressed(e);
    }
  }

  /**
   * An active transaction handle. Supports explicit {@link #commit()} and {@link #rollback()}.
   * If neither is called, {@link #close()} rolls back.
   */
  public static final class Transaction implements AutoCloseable {
    private final Connection connection;
    private final ThreadLocalTxContext txContext;
    private final int previousIsolation;
    private boolean completed;

    private Transaction(Connection connection, ThreadLocalTxContext txContext, int previousIsolation) {
      this.connection = connection;
      this.txContext = txContext;
      this.previousIsolation = previousIsolation;
    }

    public void commit() throws SQLException {
      if (completed) {
        return;
      }
      boolean committed = false;
      try {
        connection.commit();
        committed = true;
      } catch (SQLException e) {
        rollbackAfterFailedCommit(e);
        throw e;
      } finally {
        finalizeTx(committed);
      }
    }

    public void rollback() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.rollback();
      } finally {
        finalizeTx(false);
      }
    }

    @Override
    public void close() throws SQLException {
      if (!completed) {
        rollback();
      }
    }

    private void finalizeTx(boolean committed) throws SQLException {
      completed = true;
      try {
        resetConnection();
        connection.close();
      } finally {
        if (committed) {
          txContext.clearAfterCommit();
        } else {
          txContext.clearAfterRollback();
        }
      }
    }

    private void resetConnection() {
      try {
        connection.setAutoCommit(true);
        if (connection.getTransactionIsolation() != previousIsolation) {
          connection.setTransactionIsolation(previousIsolation);
        }
      } catch (SQLException e) {
        logger.log(Level.FINE, "Failed to reset connection state", e);
      }
    }

    private void rollbackAfterFailedCommit(SQLException commitFailure) {
      try {
        connection.rollback();
      } catch (SQLException e) {
        commitFailure.addSuppressed(e);
      }
    }
  }
}
