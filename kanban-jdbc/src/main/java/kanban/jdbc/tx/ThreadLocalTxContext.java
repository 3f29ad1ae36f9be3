package kanban.jdbc.tx;

import kanban.spi.TxContext;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link TxContext} implementation that stores transaction state in a {@link ThreadLocal}.
 *
 * <p>Bound and cleared by {@link JdbcTransactionManager}. Callbacks registered through
 * {@link #afterCommit} run once the commit has succeeded; a failing callback is logged
 * and does not affect the others or the outcome of the transaction.
 *
 * @see JdbcTransactionManager
 * @see TxContext
 */
public final class ThreadLocalTxContext implements TxContext {
  private static final Logger logger = Logger.getLogger(ThreadLocalTxContext.class.getName());

  private final ThreadLocal<TxState> state = new ThreadLocal<>();

  @Override
  public boolean isTransactionActive() {
    return state.get() != null;
  }

  @Override
  public Connection currentConnection() {
    return active().connection;
  }

  @Override
  public void afterCommit(Runnable callback) {
    active().afterCommit.add(callback);
  }

  @Override
  public void afterRollback(Runnable callback) {
    active().afterRollback.add(callback);
  }

  private TxState active() {
    TxState current = state.get();
    if (current == null) {
      throw new IllegalStateException("No active transaction");
    }
    return current;
  }

  void bind(Connection connection) {
    if (state.get() != null) {
      throw new IllegalStateException("Transaction already active");
    }
    state.set(new TxState(connection));
  }

  void clearAfterCommit() {
    TxState current = state.get();
    if (current == null) {
      return;
    }
    state.remove();
    runAll("afterCommit", current.afterCommit);
  }

  void clearAfterRollback() {
    TxState current = state.get();
    if (current == null) {
      return;
    }
    state.remove();
    runAll("afterRollback", current.afterRollback);
  }

  private static void runAll(String phase, List<Runnable> callbacks) {
    for (Runnable callback : callbacks) {
      try {
        callback.run();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, phase + " callback failed", e);
      }
    }
  }

  private static final class TxState {
    private final Connection connection;
    private final List<Runnable> afterCommit = new ArrayList<>();
    private final List<Runnable> afterRollback = new ArrayList<>();

    private TxState(Connection connection) {
      this.connection = connection;
    }
  }
}
