package kanban.spring;

import kanban.ConflictException;
import kanban.jdbc.tx.SqlFailures;
import kanban.spi.MetricsExporter;
import kanban.spi.TransactionRunner;
import kanban.spi.TxContext;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link TransactionRunner} on a Spring {@link PlatformTransactionManager}.
 *
 * <p>Each call runs in a {@link TransactionTemplate} with {@code PROPAGATION_REQUIRED}, so
 * a call made inside an existing Spring transaction joins it. The board store reaches the
 * transaction's connection through the given {@link TxContext}, normally a
 * {@link SpringTxContext}.
 *
 * <p>Retry and error translation match {@link kanban.jdbc.tx.JdbcTransactionRunner}:
 * serialization failures and deadlocks are retried up to {@code maxAttempts} times in
 * total when this call started the transaction; other store failures become
 * {@link kanban.ConflictException} or {@link kanban.StoreUnavailableException}.
 */
public final class SpringTransactionRunner implements TransactionRunner {
  private static final Logger logger = Logger.getLogger(SpringTransactionRunner.class.getName());

  private final TransactionTemplate template;
  private final TxContext txContext;
  private final int maxAttempts;
  private final MetricsExporter metrics;

  /**
   * @param transactionManager Spring transaction manager for the store's data source
   * @param txContext          context bound to the same data source and to Spring's
   *                           transaction synchronization
   * @param isolationLevel     one of the {@code TransactionDefinition.ISOLATION_*} constants
   * @param maxAttempts        attempts per transaction, the first included; must be &ge; 1
   * @param metrics            exporter for retry counts; {@code null} defaults to NOOP
   */
  public SpringTransactionRunner(PlatformTransactionManager transactionManager, TxContext txContext,
      int isolationLevel, int maxAttempts, MetricsExporter metrics) {
    Objects.requireNonNull(transactionManager, "transactionManager");
    this.txContext = Objects.requireNonNull(txContext, "txContext");
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    this.template = new TransactionTemplate(transactionManager);
    this.template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
    this.template.setIsolationLevel(isolationLevel);
    this.maxAttempts = maxAttempts;
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  public SpringTransactionRunner(PlatformTransactionManager transactionManager, TxContext txContext) {
    this(transactionManager, txContext, TransactionDefinition.ISOLATION_READ_COMMITTED, 3, MetricsExporter.NOOP);
  }

  @Override
  public <T> T inTransaction(TransactionalWork<T> work) {
    Objects.requireNonNull(work, "work");
    boolean outermost = !txContext.isTransactionActive();
    int attempt = 0;
    while (true) {
      attempt++;
      RuntimeException failure;
      try {
        return template.execute(status -> work.execute(txContext));
      } catch (TransactionException | DataAccessException e) {
        failure = e;
      } catch (RuntimeException e) {
        if (SqlFailures.sqlException(e) == null) {
          throw e;
        }
        failure = e;
      }
      if (outermost && isRetryable(failure) && attempt < maxAttempts) {
        metrics.incrementTransactionRetry();
        logger.log(Level.WARNING, "Transaction aborted (attempt {0}/{1}), retrying: {2}",
            new Object[] {attempt, maxAttempts, failure.getMessage()});
        continue;
      }
      throw translate(failure, attempt);
    }
  }

  private static RuntimeException translate(RuntimeException failure, int attempts) {
    if (failure instanceof ConcurrencyFailureException) {
      return new ConflictException(
          "Transaction aborted by concurrent writers after " + attempts + " attempts", failure);
    }
    if (failure instanceof DataIntegrityViolationException) {
      return new ConflictException("Write conflicts with concurrent change: " + failure.getMessage(), failure);
    }
    return SqlFailures.translate(failure, attempts);
  }

  private static boolean isRetryable(RuntimeException failure) {
    return failure instanceof ConcurrencyFailureException || SqlFailures.isRetryable(failure);
  }
}
