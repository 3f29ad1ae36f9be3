package kanban.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import kanban.ErrorKind;
import kanban.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code kanban.mutation.committed}: committed mutations, tagged {@code operation}</li>
 *   <li>{@code kanban.mutation.rejected}: mutations returned as rejected, tagged {@code kind}</li>
 *   <li>{@code kanban.order.rebalance}: committed collection rebalances</li>
 *   <li>{@code kanban.tx.retry}: transactions restarted after a serialization failure</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code kanban.mutation.latency}: engine operation wall time, tagged {@code operation}</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Counter rebalances;
  private final Counter transactionRetries;
  private final Map<String, Counter> committedByOperation = new ConcurrentHashMap<>();
  private final Map<ErrorKind, Counter> rejectedByKind = new ConcurrentHashMap<>();
  private final Map<String, Timer> latencyByOperation = new ConcurrentHashMap<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "kanban"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "kanban");
  }

  /**
   * Creates an exporter with a custom metric name prefix.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "tasks.kanban"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }
    this.registry = registry;
    this.namePrefix = namePrefix;
    this.rebalances = Counter.builder(namePrefix + ".order.rebalance")
        .description("Collections rebalanced after order key exhaustion")
        .register(registry);
    this.transactionRetries = Counter.builder(namePrefix + ".tx.retry")
        .description("Transactions restarted after a serialization failure or deadlock")
        .register(registry);
  }

  @Override
  public void incrementCommitted(String operation) {
    if (closed) return;
    committedByOperation.computeIfAbsent(operation, op ->
        Counter.builder(namePrefix + ".mutation.committed")
            .description("Committed mutations")
            .tag("operation", op)
            .register(registry))
        .increment();
  }

  @Override
  public void incrementRejected(ErrorKind kind) {
    if (closed) return;
    rejectedByKind.computeIfAbsent(kind, k ->
        Counter.builder(namePrefix + ".mutation.rejected")
            .description("Mutations rejected")
            .tag("kind", k.name())
            .register(registry))
        .increment();
  }

  @Override
  public void incrementRebalance() {
    if (closed) return;
    rebalances.increment();
  }

  @Override
  public void incrementTransactionRetry() {
    if (closed) return;
    transactionRetries.increment();
  }

  @Override
  public void recordMutationLatencyMs(String operation, long latencyMs) {
    if (closed) return;
    latencyByOperation.computeIfAbsent(operation, op ->
        Timer.builder(namePrefix + ".mutation.latency")
            .description("Engine operation wall time")
            .tag("operation", op)
            .register(registry))
        .record(latencyMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>();
    meters.add(rebalances);
    meters.add(transactionRetries);
    meters.addAll(committedByOperation.values());
    meters.addAll(rejectedByKind.values());
    meters.addAll(latencyByOperation.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
