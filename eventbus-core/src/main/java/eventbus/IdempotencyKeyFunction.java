package eventbus;

/**
 * Derives the business idempotency key of an event for one handler.
 *
 * <p>The key identifies the underlying business operation, e.g.
 * {@code "task-created-for-project-" + projectId}. Once a handler completes for a key, later
 * events producing the same key are skipped for that handler. Returning {@code null} means
 * "no key": the handler runs every time.
 *
 * @see HandlerDescriptor.Builder#idempotencyKey(IdempotencyKeyFunction)
 * @see eventbus.spi.IdempotencyStore
 */
@FunctionalInterface
public interface IdempotencyKeyFunction {

  /**
   * @param event the published event
   * @return the idempotency key, or {@code null} to always run
   */
  String keyFor(Event event);
}
