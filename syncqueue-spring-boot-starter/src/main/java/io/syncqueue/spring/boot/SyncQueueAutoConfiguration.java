package io.syncqueue.spring.boot;

import io.syncqueue.QueueListener;
import io.syncqueue.SyncQueueEngine;
import io.syncqueue.config.QueueConfig;
import io.syncqueue.dispatch.ExponentialBackoffRetryPolicy;
import io.syncqueue.dispatch.RetryPolicy;
import io.syncqueue.jdbc.JdbcEventStores;
import io.syncqueue.spi.EventProcessor;
import io.syncqueue.spi.EventStore;
import io.syncqueue.spi.MetricsExporter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the sync queue engine.
 *
 * <p>Detects a JDBC {@link EventStore} from the {@link DataSource} and, once the
 * application supplies an {@link EventProcessor} bean, wires a {@link SyncQueueEngine}
 * driven by {@link SyncQueueProperties}. {@link QueueListener} beans are registered in
 * order and a {@link MetricsExporter} bean is used when present.
 *
 * @see SyncQueueProperties
 * @see SyncQueueMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(SyncQueueEngine.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(SyncQueueProperties.class)
public class SyncQueueAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(EventStore.class)
  public EventStore syncEventStore(DataSource dataSource, SyncQueueProperties props) {
    return JdbcEventStores.detect(dataSource, props.getTableName(), props.getLockTimeout());
  }

  @Bean
  @ConditionalOnMissingBean
  public QueueConfig syncQueueConfig(SyncQueueProperties props) {
    return props.toQueueConfig();
  }

  @Bean
  @ConditionalOnMissingBean
  public RetryPolicy syncQueueRetryPolicy(SyncQueueProperties props) {
    long maxDelayMs = props.getRetry().getMaxDelayMs();
    return maxDelayMs > 0
        ? new ExponentialBackoffRetryPolicy(maxDelayMs)
        : new ExponentialBackoffRetryPolicy();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnBean(EventProcessor.class)
  public SyncQueueEngine syncQueueEngine(EventStore eventStore,
      EventProcessor eventProcessor,
      QueueConfig syncQueueConfig,
      RetryPolicy syncQueueRetryPolicy,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<QueueListener> listenerProvider) {
    SyncQueueEngine.Builder builder = SyncQueueEngine.builder()
        .store(eventStore)
        .processor(eventProcessor)
        .config(syncQueueConfig)
        .retryPolicy(syncQueueRetryPolicy)
        .listeners(listenerProvider.orderedStream().toList());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnBean(SyncQueueEngine.class)
  public SyncQueueEngineLifecycle syncQueueEngineLifecycle(SyncQueueEngine syncQueueEngine,
      QueueConfig syncQueueConfig, SyncQueueProperties props) {
    return new SyncQueueEngineLifecycle(syncQueueEngine, syncQueueConfig, props.isAutoStart());
  }
}
