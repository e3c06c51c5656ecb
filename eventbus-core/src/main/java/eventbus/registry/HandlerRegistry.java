package eventbus.registry;

import eventbus.HandlerDescriptor;
import eventbus.InvalidPolicyException;

import java.util.List;
import java.util.Set;

/**
 * Maps event names to the ordered handlers registered for them.
 *
 * <p>The bus reads this registry on every publish; writes happen at bootstrap and on
 * re-registration. Implementations must allow lookups while a registration is in progress.
 *
 * @see DefaultHandlerRegistry
 */
public interface HandlerRegistry {

  /**
   * Registers a handler, replacing any registration with the same
   * {@code (eventName, module, handlerId)}.
   *
   * @param descriptor the handler descriptor
   * @return the handler id of the registration
   * @throws InvalidPolicyException if the descriptor's retry policy or timeout is unusable
   */
  String register(HandlerDescriptor descriptor);

  /**
   * Returns the handlers registered for an event, in registration order.
   *
   * @param eventName the event name
   * @return an immutable snapshot; empty when nothing is registered
   */
  List<HandlerDescriptor> lookup(String eventName);

  /**
   * Removes the registration with the given handler id.
   *
   * @param eventName the event name
   * @param handlerId the handler id returned by {@link #register}
   * @return {@code true} if a registration was removed
   */
  boolean unregister(String eventName, String handlerId);

  /**
   * @return names of all events that currently have at least one handler
   */
  Set<String> eventNames();

  default int handlerCount(String eventName) {
    return lookup(eventName).size();
  }

  default boolean hasHandlers(String eventName) {
    return !lookup(eventName).isEmpty();
  }

  /**
   * Removes every registration.
   */
  void clear();
}
