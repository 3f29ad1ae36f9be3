package kanban.jdbc.tx;

import kanban.ConflictException;
import kanban.StoreUnavailableException;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTransientConnectionException;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Classifies store failures by the SQLState of the first {@link SQLException} in the cause
 * chain and translates them into engine errors.
 *
 * <ul>
 *   <li>serialization failure or deadlock ({@code 40001}, {@code 40P01}): retryable;</li>
 *   <li>integrity violation (class {@code 23}) or lock timeout: {@link ConflictException};</li>
 *   <li>anything else, including lost connections (class {@code 08}):
 *       {@link StoreUnavailableException}.</li>
 * </ul>
 */
public final class SqlFailures {
  private static final Logger logger = Logger.getLogger(SqlFailures.class.getName());

  private static final Set<String> RETRYABLE_STATES = Set.of("40001", "40P01");
  // PostgreSQL lock_not_available, H2 lock timeout
  private static final Set<String> LOCK_TIMEOUT_STATES = Set.of("55P03", "HYT00");
  private static final int MYSQL_LOCK_WAIT_TIMEOUT = 1205;

  private SqlFailures() {}

  /**
   * Returns the first {@link SQLException} in the cause chain of {@code failure}, or {@code null}.
   */
  public static SQLException sqlException(Throwable failure) {
    for (Throwable t = failure; t != null; t = t.getCause()) {
      if (t instanceof SQLException e) {
        return e;
      }
      if (t.getCause() == t) {
        break;
      }
    }
    return null;
  }

  public static String sqlState(Throwable failure) {
    SQLException e = sqlException(failure);
    return e == null ? null : e.getSQLState();
  }

  /**
   * Returns {@code true} if the transaction was aborted by the database to resolve
   * contention, so running it again may succeed.
   */
  public static boolean isRetryable(Throwable failure) {
    String state = sqlState(failure);
    return state != null && RETRYABLE_STATES.contains(state);
  }

  /**
   * Translates a failure that exhausted its attempts or is not retryable.
   *
   * @param attempts number of attempts made
   */
  public static RuntimeException translate(Throwable failure, int attempts) {
    SQLException sqlFailure = sqlException(failure);
    String state = sqlFailure == null ? null : sqlFailure.getSQLState();
    if (state != null && RETRYABLE_STATES.contains(state)) {
      return new ConflictException(
          "Transaction aborted by concurrent writers after " + attempts + " attempts", failure);
    }
    if (state != null && state.startsWith("23")) {
      return new ConflictException("Write conflicts with concurrent change: " + sqlFailure.getMessage(), failure);
    }
    if ((state != null && LOCK_TIMEOUT_STATES.contains(state))
        || (sqlFailure != null && sqlFailure.getErrorCode() == MYSQL_LOCK_WAIT_TIMEOUT)) {
      return new ConflictException("Timed out waiting for a row lock", failure);
    }
    if ((state != null && state.startsWith("08"))
        || sqlFailure instanceof SQLTransientConnectionException
        || sqlFailure instanceof SQLNonTransientConnectionException) {
      logger.log(Level.WARNING, "Store connection failed", failure);
      return new StoreUnavailableException("Store connection failed", failure);
    }
    logger.log(Level.WARNING, "Store failure", failure);
    return new StoreUnavailableException("Store failure: " + failure.getMessage(), failure);
  }
}
