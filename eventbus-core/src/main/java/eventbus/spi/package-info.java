/**
 * Service Provider Interfaces (SPI) for extending the event bus.
 *
 * <p>These interfaces define the extension points that integrators implement
 * to plug in durable idempotency tracking and metrics.
 *
 * @see eventbus.spi.IdempotencyStore
 * @see eventbus.spi.MetricsExporter
 */
package eventbus.spi;
