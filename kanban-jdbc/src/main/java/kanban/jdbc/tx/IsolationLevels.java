package kanban.jdbc.tx;

import java.sql.Connection;
import java.util.Locale;

/**
 * Maps isolation level names such as {@code "READ_COMMITTED"} to
 * {@code Connection.TRANSACTION_*} constants.
 */
public final class IsolationLevels {

  private IsolationLevels() {}

  public static int parse(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Isolation level cannot be blank");
    }
    switch (name.trim().toUpperCase(Locale.ROOT).replace('-', '_')) {
      case "READ_UNCOMMITTED":
        return Connection.TRANSACTION_READ_UNCOMMITTED;
      case "READ_COMMITTED":
        return Connection.TRANSACTION_READ_COMMITTED;
      case "REPEATABLE_READ":
        return Connection.TRANSACTION_REPEATABLE_READ;
      case "SERIALIZABLE":
        return Connection.TRANSACTION_SERIALIZABLE;
      default:
        throw new IllegalArgumentException("Unknown isolation level: " + name);
    }
  }

  static int validate(int level) {
    if (level != Connection.TRANSACTION_READ_UNCOMMITTED
        && level != Connection.TRANSACTION_READ_COMMITTED
        && level != Connection.TRANSACTION_REPEATABLE_READ
        && level != Connection.TRANSACTION_SERIALIZABLE) {
      throw new IllegalArgumentException("Unsupported isolation level: " + level);
    }
    return level;
  }
}
