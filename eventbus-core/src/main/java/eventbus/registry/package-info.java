/**
 * Handler routing by event name.
 *
 * <p>The registry maps each event name to the ordered list of handlers that react to it.
 * Publishing an event with no registered handler is a silent no-op.
 *
 * @see eventbus.registry.HandlerRegistry
 * @see eventbus.registry.DefaultHandlerRegistry
 */
package eventbus.registry;
