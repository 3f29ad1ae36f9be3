package kanban.benchmark;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import kanban.jdbc.store.AbstractJdbcBoardStore;
import kanban.jdbc.store.H2BoardStore;
import kanban.jdbc.store.MySqlBoardStore;
import kanban.jdbc.store.PostgresBoardStore;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates a {@link DatabaseSetup} for the requested database type.
 *
 * <p>Supported types: {@code "h2"} (in-memory), {@code "mysql"} and {@code "postgresql"}
 * (external servers). External connection details come from system properties:
 * <ul>
 *   <li>{@code bench.mysql.url}, default {@code jdbc:mysql://localhost:3306/kanban_bench}</li>
 *   <li>{@code bench.mysql.user}, default {@code root}</li>
 *   <li>{@code bench.mysql.password}, default empty</li>
 *   <li>{@code bench.pg.url}, default {@code jdbc:postgresql://localhost:5432/kanban_bench}</li>
 *   <li>{@code bench.pg.user}, default {@code postgres}</li>
 *   <li>{@code bench.pg.password}, default {@code postgres}</li>
 * </ul>
 *
 * <p>The board tables are dropped and recreated from the schema shipped in kanban-jdbc.
 */
final class BenchmarkDataSourceFactory {

  record DatabaseSetup(HikariDataSource dataSource, AbstractJdbcBoardStore store) {}

  private static final String[] TABLES = {
      "kb_comment", "kb_card_label", "kb_label", "kb_card", "kb_list", "kb_membership", "kb_board"};

  static DatabaseSetup create(String database, String dbName) {
    switch (database) {
      case "h2":
        return setup(pool("jdbc:h2:mem:" + dbName + ";DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000", "sa", "", "bench-h2"),
            "h2", new H2BoardStore());
      case "mysql":
        return setup(pool(
            System.getProperty("bench.mysql.url", "jdbc:mysql://localhost:3306/kanban_bench"),
            System.getProperty("bench.mysql.user", "root"),
            System.getProperty("bench.mysql.password", ""),
            "bench-mysql"), "mysql", new MySqlBoardStore());
      case "postgresql":
        return setup(pool(
            System.getProperty("bench.pg.url", "jdbc:postgresql://localhost:5432/kanban_bench"),
            System.getProperty("bench.pg.user", "postgres"),
            System.getProperty("bench.pg.password", "postgres"),
            "bench-pg"), "postgresql", new PostgresBoardStore());
      default:
        throw new IllegalArgumentException("Unsupported database: " + database);
    }
  }

  private static HikariDataSource pool(String url, String user, String password, String poolName) {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(url);
    config.setUsername(user);
    config.setPassword(password);
    config.setPoolName(poolName);
    config.setMaximumPoolSize(10);
    config.setMinimumIdle(2);
    return new HikariDataSource(config);
  }

  private static DatabaseSetup setup(HikariDataSource ds, String dialect, AbstractJdbcBoardStore store) {
    try (Connection conn = ds.getConnection(); Statement stmt = conn.createStatement()) {
      for (String table : TABLES) {
        stmt.execute("DROP TABLE IF EXISTS " + table);
      }
      for (String sql : loadSchema(dialect).split(";")) {
        String trimmed = sql.trim();
        if (!trimmed.isEmpty()) {
          stmt.execute(trimmed);
        }
      }
    } catch (SQLException | IOException e) {
      ds.close();
      throw new IllegalStateException("Failed to initialize benchmark schema", e);
    }
    return new DatabaseSetup(ds, store);
  }

  private static String loadSchema(String dialect) throws IOException {
    String path = "/schema/" + dialect + ".sql";
    try (InputStream is = BenchmarkDataSourceFactory.class.getResourceAsStream(path)) {
      if (is == null) {
        throw new IOException("Resource not found: " + path);
      }
      return new String(is.readAllBytes(), StandardCharsets.UTF_8);
    }
  }

  private BenchmarkDataSourceFactory() {}
}
