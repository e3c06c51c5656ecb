package eventbus.spring.boot;

import eventbus.EventBus;
import eventbus.dispatch.CircuitBreaker;
import eventbus.dispatch.HandlerInterceptor;
import eventbus.idempotency.InMemoryIdempotencyStore;
import eventbus.jdbc.JdbcIdempotencyStore;
import eventbus.registry.DefaultHandlerRegistry;
import eventbus.registry.HandlerRegistry;
import eventbus.spi.IdempotencyStore;
import eventbus.spi.MetricsExporter;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Auto-configuration for the event bus.
 *
 * <p>Creates an {@link EventBus} from {@link EventBusProperties}, a handler registry and an
 * idempotency store, then bootstraps {@link EventSubscriber} beans and
 * {@link eventbus.bootstrap.HandlerModule} beans into the registry.
 *
 * <p>With {@code eventbus.idempotency.store=JDBC} completion records go to a table through
 * {@code eventbus-jdbc}, which must be on the classpath together with a {@link DataSource}.
 *
 * @see EventBusProperties
 * @see EventBusMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(EventBus.class)
@EnableConfigurationProperties(EventBusProperties.class)
public class EventBusAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public HandlerRegistry handlerRegistry() {
    return new DefaultHandlerRegistry();
  }

  @Bean
  @ConditionalOnMissingBean(IdempotencyStore.class)
  @ConditionalOnProperty(prefix = "eventbus.idempotency", name = "store", havingValue = "MEMORY",
      matchIfMissing = true)
  public InMemoryIdempotencyStore idempotencyStore() {
    return new InMemoryIdempotencyStore();
  }

  @Bean
  @ConditionalOnMissingBean
  public EventSubscriberRegistrar eventSubscriberRegistrar(ListableBeanFactory beanFactory,
      HandlerRegistry handlerRegistry) {
    return new EventSubscriberRegistrar(beanFactory, handlerRegistry);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public EventBus eventBus(EventBusProperties props,
      HandlerRegistry handlerRegistry,
      ObjectProvider<IdempotencyStore> idempotencyStoreProvider,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<HandlerInterceptor> interceptorProvider) {

    IdempotencyStore store = idempotencyStoreProvider.getIfAvailable();
    if (store == null) {
      throw new IllegalStateException("No IdempotencyStore for eventbus.idempotency.store="
          + props.getIdempotency().getStore()
          + "; JDBC needs eventbus-jdbc on the classpath and a DataSource bean");
    }
    var cb = props.getCircuitBreaker();
    var builder = EventBus.builder()
        .registry(handlerRegistry)
        .idempotencyStore(store)
        .circuitBreaker(new CircuitBreaker(cb.getFailureThreshold(), cb.getRecoveryTimeoutMs()))
        .enabled(props.isEnabled())
        .defaultRetryPolicy(props.getDefaultRetry().toPolicy())
        .maxDelayMs(props.getDefaultRetry().getMaxDelayMs())
        .defaultTimeoutMs(props.getDefaultTimeoutMs())
        .inFlightRecheckMs(props.getDispatcher().getInFlightRecheckMs())
        .drainTimeoutMs(props.getDispatcher().getDrainTimeoutMs());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    interceptorProvider.orderedStream().forEach(builder::interceptor);
    return builder.build();
  }

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(name = "eventbus.jdbc.JdbcIdempotencyStore")
  @ConditionalOnBean(DataSource.class)
  @ConditionalOnProperty(prefix = "eventbus.idempotency", name = "store", havingValue = "JDBC")
  static class JdbcIdempotencyConfiguration {

    @Bean
    @ConditionalOnMissingBean(IdempotencyStore.class)
    JdbcIdempotencyStore idempotencyStore(DataSource dataSource, EventBusProperties props) {
      return JdbcIdempotencyStore.forDataSource(dataSource, props.getIdempotency().getTableName());
    }
  }
}
