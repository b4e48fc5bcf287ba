package io.recall.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.recall.micrometer.MicrometerMetricsExporter;
import io.recall.spi.MetricsExporter;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics.
 *
 * <p>Activates when {@code recall-micrometer} and a {@link MeterRegistry} bean are present.
 * Disable with {@code recall.metrics.enabled=false}.
 */
@AutoConfiguration(before = RecallAutoConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MeterRegistry.class, MicrometerMetricsExporter.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "recall.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(RecallProperties.class)
public class RecallMicrometerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter recallMetricsExporter(MeterRegistry registry, RecallProperties properties) {
    return new MicrometerMetricsExporter(registry, properties.getMetrics().getNamePrefix());
  }
}
