/**
 * Spring Boot auto-configuration for the event bus.
 *
 * <p>Adding the starter gives an {@link eventbus.EventBus} bean; handlers are declared with
 * {@link eventbus.spring.boot.EventSubscriber} or as {@link eventbus.bootstrap.HandlerModule}
 * beans. Settings live under the {@code eventbus} prefix, see
 * {@link eventbus.spring.boot.EventBusProperties}.
 */
package eventbus.spring.boot;
