package kanban.spring.boot;

import kanban.KanbanClient;
import kanban.engine.MutationEngine;
import kanban.jdbc.store.AbstractJdbcBoardStore;
import kanban.jdbc.store.JdbcBoardStores;
import kanban.jdbc.tx.IsolationLevels;
import kanban.retry.ExponentialBackoffRetryPolicy;
import kanban.spi.MetricsExporter;
import kanban.spi.TransactionRunner;
import kanban.spi.TxContext;
import kanban.spring.SpringTransactionRunner;
import kanban.spring.SpringTxContext;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

/**
 * Auto-configuration for the Kanban engine.
 *
 * <p>Wires a {@link MutationEngine} and a {@link KanbanClient} from a {@link DataSource}
 * and {@link KanbanProperties}. Mutations run in Spring-managed transactions, so an
 * engine call made inside a {@code @Transactional} method joins that transaction.
 *
 * @see KanbanProperties
 * @see KanbanMicrometerAutoConfiguration
 */
@AutoConfiguration(after = {
    DataSourceAutoConfiguration.class, DataSourceTransactionManagerAutoConfiguration.class})
@ConditionalOnClass(MutationEngine.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(KanbanProperties.class)
public class KanbanAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcBoardStore boardStore(DataSource dataSource, KanbanProperties props) {
    return JdbcBoardStores.detect(dataSource, props.getTablePrefix());
  }

  @Bean
  @ConditionalOnMissingBean(TxContext.class)
  public SpringTxContext txContext(DataSource dataSource) {
    return new SpringTxContext(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(TransactionRunner.class)
  public SpringTransactionRunner transactionRunner(DataSource dataSource,
      TxContext txContext,
      KanbanProperties props,
      ObjectProvider<PlatformTransactionManager> transactionManagerProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {
    PlatformTransactionManager transactionManager =
        transactionManagerProvider.getIfAvailable(() -> new DataSourceTransactionManager(dataSource));
    // Connection.TRANSACTION_* and TransactionDefinition.ISOLATION_* share values
    int isolation = IsolationLevels.parse(props.getTransaction().getIsolation());
    return new SpringTransactionRunner(transactionManager, txContext, isolation,
        props.getTransaction().getMaxAttempts(), metricsProvider.getIfAvailable());
  }

  @Bean
  @ConditionalOnMissingBean
  public MutationEngine mutationEngine(AbstractJdbcBoardStore boardStore,
      TransactionRunner transactionRunner,
      ObjectProvider<MetricsExporter> metricsProvider) {
    MutationEngine.Builder builder = MutationEngine.builder()
        .store(boardStore)
        .transactionRunner(transactionRunner);
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public KanbanClient kanbanClient(MutationEngine mutationEngine, KanbanProperties props,
      ObjectProvider<MetricsExporter> metricsProvider) {
    KanbanProperties.Retry retry = props.getClient().getRetry();
    KanbanClient.Builder builder = KanbanClient.builder()
        .engine(mutationEngine)
        .retryPolicy(new ExponentialBackoffRetryPolicy(retry.getBaseDelayMs(), retry.getMaxDelayMs()))
        .maxAttempts(retry.getMaxAttempts());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }
}
