package kanban.jdbc.tx;

import kanban.ConflictException;
import kanban.ErrorKind;
import kanban.StoreUnavailableException;
import kanban.jdbc.KanbanStoreException;

import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;

import static org.junit.jupiter.api.Assertions.*;

class SqlFailuresTest {

  @Test
  void findsSqlExceptionDeepInCauseChain() {
    SQLException root = new SQLException("deadlock", "40P01");
    RuntimeException wrapped = new RuntimeException(new KanbanStoreException("Failed to execute update", root));

    assertSame(root, SqlFailures.sqlException(wrapped));
    assertEquals("40P01", SqlFailures.sqlState(wrapped));
  }

  @Test
  void noSqlExceptionMeansNoState() {
    assertNull(SqlFailures.sqlException(new IllegalStateException("boom")));
    assertNull(SqlFailures.sqlState(new IllegalStateException("boom")));
    assertFalse(SqlFailures.isRetryable(new IllegalStateException("boom")));
  }

  @Test
  void serializationFailureAndDeadlockAreRetryable() {
    assertTrue(SqlFailures.isRetryable(new SQLException("serialization", "40001")));
    assertTrue(SqlFailures.isRetryable(wrap(new SQLException("deadlock", "40P01"))));
    assertFalse(SqlFailures.isRetryable(new SQLException("duplicate", "23505")));
    assertFalse(SqlFailures.isRetryable(new SQLException("no state")));
  }

  @Test
  void exhaustedRetryableFailureBecomesConflict() {
    RuntimeException translated = SqlFailures.translate(wrap(new SQLException("serialization", "40001")), 3);

    assertInstanceOf(ConflictException.class, translated);
    assertTrue(translated.getMessage().contains("3 attempts"));
  }

  @Test
  void integrityViolationBecomesConflict() {
    SQLException duplicate = new SQLException("Unique index violation", "23505");

    RuntimeException translated = SqlFailures.translate(wrap(duplicate), 1);

    ConflictException conflict = assertInstanceOf(ConflictException.class, translated);
    assertEquals(ErrorKind.CONFLICT, conflict.kind());
    assertTrue(conflict.getMessage().contains("Unique index violation"));
  }

  @Test
  void lockTimeoutsBecomeConflict() {
    assertInstanceOf(ConflictException.class, SqlFailures.translate(new SQLException("lock", "55P03"), 1));
    assertInstanceOf(ConflictException.class, SqlFailures.translate(new SQLException("lock", "HYT00"), 1));
    assertInstanceOf(ConflictException.class,
        SqlFailures.translate(new SQLException("Lock wait timeout exceeded", "HY000", 1205), 1));
  }

  @Test
  void lostConnectionBecomesStoreUnavailable() {
    RuntimeException bySqlState = SqlFailures.translate(new SQLException("gone", "08006"), 1);
    RuntimeException byType = SqlFailures.translate(new SQLTransientConnectionException("pool exhausted"), 1);

    StoreUnavailableException unavailable = assertInstanceOf(StoreUnavailableException.class, bySqlState);
    assertEquals(ErrorKind.STORE_UNAVAILABLE, unavailable.kind());
    assertInstanceOf(StoreUnavailableException.class, byType);
  }

  @Test
  void unknownFailureBecomesStoreUnavailable() {
    SQLException syntax = new SQLException("Syntax error", "42000");

    RuntimeException translated = SqlFailures.translate(wrap(syntax), 1);

    assertInstanceOf(StoreUnavailableException.class, translated);
    assertSame(syntax, SqlFailures.sqlException(translated));
  }

  private static KanbanStoreException wrap(SQLException e) {
    return new KanbanStoreException("Failed to execute update", e);
  }
}
