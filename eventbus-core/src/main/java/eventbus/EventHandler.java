package eventbus;

/**
 * Reaction of a module to a named {@link Event}.
 *
 * <p>Handlers run on dispatcher worker threads, concurrently with every other handler
 * registered for the same event. A handler signals failure by throwing; the bus then retries
 * according to the descriptor's {@link RetryPolicy} and, once attempts are used up, logs the
 * failure. Nothing a handler throws ever reaches the publisher.
 *
 * <h2>Idempotency</h2>
 * <p>Delivery is at-least-once: a handler may run again after a failed or timed-out attempt,
 * even if that attempt's side effect partially happened. Declare an
 * {@link IdempotencyKeyFunction} on the descriptor so a completed effect is not repeated.
 *
 * <h2>Timeouts</h2>
 * <p>An attempt that outlives its timeout is abandoned: the worker thread is interrupted and
 * any later result is ignored. Handlers doing blocking I/O should respond to interruption.
 *
 * <pre>{@code
 * EventHandler createInitialTask = event -> {
 *   ProjectCreated project = event.dataAs(ProjectCreated.class);
 *   taskService.createInitialTask(project.projectId(), project.name());
 * };
 * }</pre>
 *
 * @see HandlerDescriptor
 */
@FunctionalInterface
public interface EventHandler {

  /**
   * Processes an event.
   *
   * @param event the published event
   * @throws Exception if processing fails; triggers retry or exhaustion handling
   */
  void handle(Event event) throws Exception;
}
