package kanban.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import kanban.micrometer.MicrometerMetricsExporter;
import kanban.spi.MetricsExporter;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath,
 * a {@link MeterRegistry} bean exists and {@code kanban.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link KanbanAutoConfiguration} so the {@link MetricsExporter}
 * bean is available to the engine, the client and the transaction runner.
 */
@AutoConfiguration(before = KanbanAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "kanban.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(KanbanProperties.class)
public class KanbanMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, KanbanProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
