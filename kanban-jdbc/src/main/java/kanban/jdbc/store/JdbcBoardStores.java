package kanban.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC board stores with auto-detection support.
 *
 * <p>Board stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/kanban.jdbc.store.AbstractJdbcBoardStore}. Registered instances
 * use the default table prefix; pass a prefix to {@link #detect(DataSource, String)} to
 * get a store for other table names.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * AbstractJdbcBoardStore store = JdbcBoardStores.detect(dataSource);
 * AbstractJdbcBoardStore store = JdbcBoardStores.detect("jdbc:postgresql://localhost/kanban");
 * AbstractJdbcBoardStore store = JdbcBoardStores.get("mysql").withTablePrefix("app_");
 * }</pre>
 */
public final class JdbcBoardStores {

  private static final List<AbstractJdbcBoardStore> STORES;
  private static final Map<String, AbstractJdbcBoardStore> BY_NAME = new ConcurrentHashMap<>();

  static {
    STORES = ServiceLoader.load(AbstractJdbcBoardStore.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcBoardStore store : STORES) {
      BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
    }
  }

  private JdbcBoardStores() {
  }

  /**
   * Returns all registered board stores.
   */
  public static List<AbstractJdbcBoardStore> all() {
    return STORES;
  }

  /**
   * Gets a board store by name.
   *
   * @param name board store name (case-insensitive)
   * @throws IllegalArgumentException if no board store has that name
   */
  public static AbstractJdbcBoardStore get(String name) {
    Objects.requireNonNull(name, "name");
    AbstractJdbcBoardStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (store == null) {
      throw new IllegalArgumentException("Unknown board store: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return store;
  }

  /**
   * Auto-detects the board store from a DataSource's JDBC URL.
   *
   * @throws IllegalStateException if the URL cannot be read
   * @throws IllegalArgumentException if no board store matches the URL
   */
  public static AbstractJdbcBoardStore detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      return detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect board store from DataSource", e);
    }
  }

  /**
   * Auto-detects the board store and binds it to tables named with {@code tablePrefix}.
   */
  public static AbstractJdbcBoardStore detect(DataSource dataSource, String tablePrefix) {
    return detect(dataSource).withTablePrefix(tablePrefix);
  }

  /**
   * Auto-detects the board store from a JDBC URL.
   *
   * @throws IllegalArgumentException if no board store matches the URL
   */
  public static AbstractJdbcBoardStore detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String url = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcBoardStore store : STORES) {
      for (String prefix : store.jdbcUrlPrefixes()) {
        if (url.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return store;
        }
      }
    }
    throw new IllegalArgumentException("No board store found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return STORES.stream()
        .flatMap(s -> s.jdbcUrlPrefixes().stream())
        .toList();
  }
}
