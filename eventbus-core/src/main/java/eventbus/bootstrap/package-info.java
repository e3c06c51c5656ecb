/**
 * Startup registration of handlers contributed by modules.
 *
 * @see eventbus.bootstrap.BootstrapLoader
 * @see eventbus.bootstrap.HandlerModule
 */
package eventbus.bootstrap;
