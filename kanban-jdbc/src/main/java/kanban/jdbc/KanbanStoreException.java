package kanban.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by {@link JdbcTemplate} and the board
 * stores. Transaction runners translate it into an engine error by the SQLState of its
 * cause; see {@link kanban.jdbc.tx.SqlFailures}.
 */
public final class KanbanStoreException extends RuntimeException {
  public KanbanStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
