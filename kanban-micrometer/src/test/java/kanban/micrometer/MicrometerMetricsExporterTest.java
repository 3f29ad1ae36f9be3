package kanban.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import kanban.ErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void committedIsTaggedByOperation() {
    exporter.incrementCommitted("moveCard");
    exporter.incrementCommitted("moveCard");
    exporter.incrementCommitted("createList");

    assertEquals(2.0, counter("kanban.mutation.committed", "operation", "moveCard").count());
    assertEquals(1.0, counter("kanban.mutation.committed", "operation", "createList").count());
  }

  @Test
  void rejectedIsTaggedByKind() {
    exporter.incrementRejected(ErrorKind.FORBIDDEN);
    exporter.incrementRejected(ErrorKind.FORBIDDEN);
    exporter.incrementRejected(ErrorKind.INVALID_POSITION);

    assertEquals(2.0, counter("kanban.mutation.rejected", "kind", "FORBIDDEN").count());
    assertEquals(1.0, counter("kanban.mutation.rejected", "kind", "INVALID_POSITION").count());
  }

  @Test
  void rebalanceAndRetryCounters() {
    exporter.incrementRebalance();
    exporter.incrementTransactionRetry();
    exporter.incrementTransactionRetry();

    assertEquals(1.0, registry.get("kanban.order.rebalance").counter().count());
    assertEquals(2.0, registry.get("kanban.tx.retry").counter().count());
  }

  @Test
  void latencyTimer() {
    exporter.recordMutationLatencyMs("moveCard", 12);
    exporter.recordMutationLatencyMs("moveCard", 8);

    Timer timer = registry.get("kanban.mutation.latency").tag("operation", "moveCard").timer();
    assertEquals(2, timer.count());
    assertEquals(20.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "tasks.kanban");
    custom.incrementRebalance();
    custom.incrementCommitted("createCard");

    assertEquals(1.0, registry.get("tasks.kanban.order.rebalance").counter().count());
    assertEquals(1.0, counter("tasks.kanban.mutation.committed", "operation", "createCard").count());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.incrementCommitted("moveCard");
    exporter.incrementRejected(ErrorKind.CONFLICT);

    exporter.close();
    exporter.incrementRebalance();

    assertNull(registry.find("kanban.order.rebalance").counter());
    assertNull(registry.find("kanban.mutation.committed").counter());
    assertNull(registry.find("kanban.mutation.rejected").counter());
  }

  @Test
  void invalidPrefixRejected() {
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "kanban."));
  }

  @Test
  void nullRegistryThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  private Counter counter(String name, String tagKey, String tagValue) {
    Counter c = registry.find(name).tag(tagKey, tagValue).counter();
    assertNotNull(c, "Counter not found: " + name + "{" + tagKey + "=" + tagValue + "}");
    return c;
  }
}
