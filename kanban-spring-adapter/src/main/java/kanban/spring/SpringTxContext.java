package kanban.spring;

import kanban.spi.TxContext;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link TxContext} implementation that bridges to Spring's transaction infrastructure
 * via {@link TransactionSynchronizationManager}.
 *
 * <p>Connections are obtained through {@link DataSourceUtils}, so board store calls join
 * the Spring-managed transaction. After-commit and after-rollback callbacks are
 * registered as {@link TransactionSynchronization} instances; a failing callback is
 * logged and never reaches the code that committed.
 *
 * @see TxContext
 */
public final class SpringTxContext implements TxContext {
  private static final Logger logger = Logger.getLogger(SpringTxContext.class.getName());

  private final DataSource dataSource;

  public SpringTxContext(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  public DataSource dataSource() {
    return dataSource;
  }

  @Override
  public boolean isTransactionActive() {
    return TransactionSynchronizationManager.isActualTransactionActive();
  }

  @Override
  public Connection currentConnection() {
    if (!isTransactionActive()) {
      throw new IllegalStateException("No active transaction");
    }
    return DataSourceUtils.getConnection(dataSource);
  }

  @Override
  public void afterCommit(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    requireSynchronizationActive("afterCommit");
    TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
      @Override
      public void afterCommit() {
        runLogged("afterCommit", callback);
      }
    });
  }

  @Override
  public void afterRollback(Runnable callback) {
    Objects.requireNonNull(callback, "callback");
    requireSynchronizationActive("afterRollback");
    TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
      @Override
      public void afterCompletion(int status) {
        if (status == STATUS_ROLLED_BACK) {
          runLogged("afterRollback", callback);
        }
      }
    });
  }

  private static void runLogged(String phase, Runnable callback) {
    try {
      callback.run();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, phase + " callback failed", e);
    }
  }

  private void requireSynchronizationActive(String operation) {
    if (!isTransactionActive()) {
      throw new IllegalStateException("No active transaction");
    }
    if (!TransactionSynchronizationManager.isSynchronizationActive()) {
      throw new IllegalStateException(
          "Transaction synchronization is not active; cannot register " + operation + " callback");
    }
  }
}
