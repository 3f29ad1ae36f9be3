package kanban.jdbc.tx;

import org.junit.jupiter.api.Test;

import java.sql.Connection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class IsolationLevelsTest {

  @Test
  void parsesStandardNames() {
    assertEquals(Connection.TRANSACTION_READ_UNCOMMITTED, IsolationLevels.parse("READ_UNCOMMITTED"));
    assertEquals(Connection.TRANSACTION_READ_COMMITTED, IsolationLevels.parse("read_committed"));
    assertEquals(Connection.TRANSACTION_REPEATABLE_READ, IsolationLevels.parse(" repeatable-read "));
    assertEquals(Connection.TRANSACTION_SERIALIZABLE, IsolationLevels.parse("Serializable"));
  }

  @Test
  void rejectsUnknownAndBlank() {
    assertThrows(IllegalArgumentException.class, () -> IsolationLevels.parse("SNAPSHOT"));
    assertThrows(IllegalArgumentException.class, () -> IsolationLevels.parse(" "));
    assertThrows(IllegalArgumentException.class, () -> IsolationLevels.parse(null));
  }

  @Test
  void validateRejectsNone() {
    assertThrows(IllegalArgumentException.class, () -> IsolationLevels.validate(Connection.TRANSACTION_NONE));
  }
}
