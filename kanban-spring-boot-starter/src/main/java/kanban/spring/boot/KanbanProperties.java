package kanban.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the Kanban engine.
 *
 * @see KanbanAutoConfiguration
 */
@ConfigurationProperties(prefix = "kanban")
public class KanbanProperties {

  /**
   * Prefix for every table name, e.g. {@code kb_} gives {@code kb_board}, {@code kb_card}.
   */
  private String tablePrefix = "kb_";

  private final Transaction transaction = new Transaction();
  private final Client client = new Client();
  private final Metrics metrics = new Metrics();

  public String getTablePrefix() {
    return tablePrefix;
  }

  public void setTablePrefix(String tablePrefix) {
    this.tablePrefix = tablePrefix;
  }

  public Transaction getTransaction() {
    return transaction;
  }

  public Client getClient() {
    return client;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Transaction {
    /**
     * Attempts per transaction when the database aborts it for serialization reasons.
     */
    private int maxAttempts = 3;

    /**
     * Isolation level name: READ_COMMITTED, REPEATABLE_READ or SERIALIZABLE.
     */
    private String isolation = "READ_COMMITTED";

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }

    public String getIsolation() {
      return isolation;
    }

    public void setIsolation(String isolation) {
      this.isolation = isolation;
    }
  }

  public static class Client {
    private final Retry retry = new Retry();

    public Retry getRetry() {
      return retry;
    }
  }

  public static class Retry {
    private long baseDelayMs = 50;
    private long maxDelayMs = 2000;

    /**
     * Submissions per mutation when the store is unavailable, the first included.
     */
    private int maxAttempts = 3;

    public long getBaseDelayMs() {
      return baseDelayMs;
    }

    public void setBaseDelayMs(long baseDelayMs) {
      this.baseDelayMs = baseDelayMs;
    }

    public long getMaxDelayMs() {
      return maxDelayMs;
    }

    public void setMaxDelayMs(long maxDelayMs) {
      this.maxDelayMs = maxDelayMs;
    }

    public int getMaxAttempts() {
      return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "kanban";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
