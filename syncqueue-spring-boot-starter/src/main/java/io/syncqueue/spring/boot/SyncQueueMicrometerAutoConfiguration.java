package io.syncqueue.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.syncqueue.micrometer.MicrometerMetricsExporter;
import io.syncqueue.spi.MetricsExporter;

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
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath, a
 * {@link MeterRegistry} bean exists and {@code syncqueue.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link SyncQueueAutoConfiguration} so the {@link MetricsExporter}
 * bean is available for injection into the engine.
 */
@AutoConfiguration(before = SyncQueueAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "syncqueue.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(SyncQueueProperties.class)
public class SyncQueueMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, SyncQueueProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
