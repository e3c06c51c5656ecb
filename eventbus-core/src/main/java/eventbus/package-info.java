/**
 * Inter-module event bus: publish named events, deliver them to every registered handler with
 * retries, timeouts and idempotency.
 *
 * <p>Entry point is {@link eventbus.EventBus}; handlers are described by
 * {@link eventbus.HandlerDescriptor} and registered at startup by
 * {@link eventbus.bootstrap.BootstrapLoader}.
 */
package eventbus;
