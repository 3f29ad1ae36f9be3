package kanban.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import kanban.ErrorKind;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import kanban.micrometer.MicrometerMetricsExporter;
import kanban.spi.MetricsExporter;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KanbanMicrometerAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(KanbanMicrometerAutoConfiguration.class))
      .withUserConfiguration(MeterRegistryConfig.class);

  @Test
  void registersMicrometerExporterWhenRegistryPresent() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("micrometerMetricsExporter"));
      assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
    });
  }

  @Test
  void exporterTagsBoardMutationsByOperationAndRejectionKind() {
    runner.run(ctx -> {
      MetricsExporter exporter = ctx.getBean(MetricsExporter.class);
      exporter.incrementCommitted("moveCard");
      exporter.incrementCommitted("moveCard");
      exporter.incrementRejected(ErrorKind.FORBIDDEN);
      MeterRegistry registry = ctx.getBean(MeterRegistry.class);
      assertEquals(2.0, registry.get("kanban.mutation.committed").tag("operation", "moveCard").counter().count());
      assertEquals(1.0, registry.get("kanban.mutation.rejected").tag("kind", "FORBIDDEN").counter().count());
      assertNull(registry.find("kanban.mutation.rejected").tag("kind", "CONFLICT").counter());
    });
  }

  @Test
  void rebalanceCounterFollowsConfiguredPrefix() {
    runner.withPropertyValues("kanban.metrics.name-prefix=team.boards").run(ctx -> {
      ctx.getBean(MetricsExporter.class).incrementRebalance();
      var registry = ctx.getBean(MeterRegistry.class);
      assertNotNull(registry.find("team.boards.order.rebalance").counter());
    });
  }

  @Test
  void metricsCanBeSwitchedOff() {
    runner.withPropertyValues("kanban.metrics.enabled=false").run(ctx -> {
      assertFalse(ctx.containsBean("micrometerMetricsExporter"));
    });
  }

  @Test
  void userSuppliedExporterWins() {
    runner.withUserConfiguration(CustomExporterConfig.class).run(ctx -> {
      var exporter = ctx.getBean(MetricsExporter.class);
      assertFalse(exporter instanceof MicrometerMetricsExporter);
    });
  }

  @Configuration
  static class MeterRegistryConfig {
    @Bean
    MeterRegistry meterRegistry() {
      return new SimpleMeterRegistry();
    }
  }

  @Configuration
  static class CustomExporterConfig {
    @Bean
    MetricsExporter customMetricsExporter() {
      return MetricsExporter.NOOP;
    }
  }
}
