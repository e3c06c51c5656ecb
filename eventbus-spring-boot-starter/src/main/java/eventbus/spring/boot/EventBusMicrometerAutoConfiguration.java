package eventbus.spring.boot;

import eventbus.micrometer.MicrometerMetricsExporter;
import eventbus.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Publishes event bus metrics to Micrometer when it is on the classpath and
 * {@code eventbus.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link EventBusAutoConfiguration} so the exporter is injected into the bus.
 * The bus removes the exporter's meters when it closes.
 */
@AutoConfiguration(before = EventBusAutoConfiguration.class,
    afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "eventbus.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(EventBusProperties.class)
public class EventBusMicrometerAutoConfiguration {

  @Bean(destroyMethod = "")
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, EventBusProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
