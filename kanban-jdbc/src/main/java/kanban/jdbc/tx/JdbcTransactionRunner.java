package kanban.jdbc.tx;

import kanban.jdbc.KanbanStoreException;
import kanban.spi.ConnectionProvider;
import kanban.spi.MetricsExporter;
import kanban.spi.TransactionRunner;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link TransactionRunner} on plain JDBC, built on {@link JdbcTransactionManager}.
 *
 * <p>A transaction aborted by a serialization failure or deadlock is run again, up to
 * {@code maxAttempts} times in total. Other store failures, and the last retryable one,
 * are translated by {@link SqlFailures} into {@link kanban.ConflictException} or
 * {@link kanban.StoreUnavailableException}. Exceptions thrown by the work itself roll
 * back and propagate unchanged.
 *
 * <p>A call made while this thread already has a transaction open joins it: the work
 * runs on the open transaction and is neither retried nor committed separately.
 */
public final class JdbcTransactionRunner implements TransactionRunner {
  private static final Logger logger = Logger.getLogger(JdbcTransactionRunner.class.getName());

  private final JdbcTransactionManager txManager;
  private final ThreadLocalTxContext txContext;
  private final int maxAttempts;
  private final MetricsExporter metrics;

  private JdbcTransactionRunner(Builder builder) {
    ConnectionProvider connectionProvider = builder.connectionProvider;
    if (connectionProvider == null && builder.dataSource != null) {
      connectionProvider = builder.dataSource::getConnection;
    }
    Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.txContext = builder.txContext != null ? builder.txContext : new ThreadLocalTxContext();
    this.txManager = new JdbcTransactionManager(connectionProvider, txContext, builder.isolationLevel);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    this.maxAttempts = builder.maxAttempts;
  }

  public static Builder builder() {
    return new Builder();
  }

  public ThreadLocalTxContext txContext() {
    return txContext;
  }

  @Override
  public <T> T inTransaction(TransactionalWork<T> work) {
    Objects.requireNonNull(work, "work");
    if (txContext.isTransactionActive()) {
      return work.execute(txContext);
    }
    int attempt = 0;
    while (true) {
      attempt++;
      Exception failure;
      try {
        return runOnce(work);
      } catch (SQLException e) {
        failure = e;
      } catch (KanbanStoreException e) {
        failure = e;
      }
      if (SqlFailures.isRetryable(failure) && attempt < maxAttempts) {
        metrics.incrementTransactionRetry();
        logger.log(Level.WARNING, "Transaction aborted with SQLState {0} (attempt {1}/{2}), retrying",
            new Object[] {SqlFailures.sqlState(failure), attempt, maxAttempts});
        continue;
      }
      throw SqlFailures.translate(failure, attempt);
    }
  }

  private <T> T runOnce(TransactionalWork<T> work) throws SQLException {
    try (JdbcTransactionManager.Transaction tx = txManager.begin()) {
      T result = work.execute(txContext);
      tx.commit();
      return result;
    }
  }

  /** Builder for {@link JdbcTransactionRunner}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private DataSource dataSource;
    private ThreadLocalTxContext txContext;
    private int isolationLevel = Connection.TRANSACTION_READ_COMMITTED;
    private int maxAttempts = 3;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the source of connections.
     *
     * <p><b>Required</b> unless {@link #dataSource} is set.
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Uses {@link DataSource#getConnection()} as the connection provider.
     *
     * @param dataSource the data source
     * @return this builder
     */
    public Builder dataSource(DataSource dataSource) {
      this.dataSource = dataSource;
      return this;
    }

    /**
     * Sets the context the connection is bound to while a transaction runs.
     *
     * <p>Optional. Defaults to a new {@link ThreadLocalTxContext}.
     *
     * @param txContext the transaction context
     * @return this builder
     */
    public Builder txContext(ThreadLocalTxContext txContext) {
      this.txContext = txContext;
      return this;
    }

    /**
     * Sets the isolation level, one of the {@code Connection.TRANSACTION_*} constants.
     *
     * <p>Optional. Defaults to {@link Connection#TRANSACTION_READ_COMMITTED}; the board row
     * lock taken by every mutation makes a stricter level unnecessary.
     *
     * @param isolationLevel the isolation level
     * @return this builder
     */
    public Builder isolationLevel(int isolationLevel) {
      this.isolationLevel = isolationLevel;
      return this;
    }

    /**
     * Sets the number of attempts for a transaction aborted by a serialization failure
     * or deadlock, the first included.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 1.
     *
     * @param maxAttempts maximum attempts
     * @return this builder
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Sets the metrics exporter that counts transaction retries.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * @throws NullPointerException if neither a connection provider nor a data source is set
     * @throws IllegalArgumentException if {@code maxAttempts < 1} or the isolation level is unknown
     */
    public JdbcTransactionRunner build() {
      return new JdbcTransactionRunner(this);
    }
  }
}
