package eventbus.bootstrap;

import eventbus.HandlerDescriptor;

import java.util.List;

/**
 * A module's contribution of event handlers.
 *
 * <p>Modules are either passed to a {@link BootstrapLoader} explicitly or discovered through
 * {@link java.util.ServiceLoader}, listed in
 * {@code META-INF/services/eventbus.bootstrap.HandlerModule}. Discovered implementations need
 * a public no-argument constructor.
 *
 * <pre>{@code
 * public final class TaskEventHandlers implements HandlerModule {
 *   public String moduleName() {
 *     return "tasks";
 *   }
 *
 *   public List<HandlerDescriptor> handlers() {
 *     return List.of(HandlerDescriptor.builder("projects:project.created")
 *         .module("tasks")
 *         .handlerId("tasks-project-created-handler")
 *         .handler(this::createInitialTask)
 *         .build());
 *   }
 * }
 * }</pre>
 */
public interface HandlerModule {

  /**
   * @return the module name, used for ordering and in bootstrap logs
   */
  String moduleName();

  /**
   * Returns the module's handlers. Called once per bootstrap.
   *
   * @return the descriptors to register
   */
  List<HandlerDescriptor> handlers();
}
