package eventbus.spi;

/**
 * Records which {@code (handlerId, idempotencyKey)} pairs have completed, so a redelivered
 * event does not repeat a handler's side effect.
 *
 * <p>A {@code null} key means the handler declared no idempotency function: such a handler
 * is never considered done, and marking it is a no-op.
 *
 * <p>Implementations must be thread-safe. Concurrent {@link #markCompleted} calls for the same
 * pair must leave exactly one record behind.
 *
 * @see eventbus.idempotency.InMemoryIdempotencyStore
 */
public interface IdempotencyStore {

  /**
   * Returns whether the handler already completed for the given key.
   *
   * @param handlerId the handler identifier
   * @param key       the idempotency key, may be {@code null}
   * @return {@code true} if a completion is recorded; always {@code false} for a {@code null} key
   */
  boolean hasCompleted(String handlerId, String key);

  /**
   * Records completion of the handler for the given key. Repeated calls are harmless.
   *
   * @param handlerId the handler identifier
   * @param key       the idempotency key, may be {@code null}
   * @return {@code true} if this call created the record, {@code false} if it already existed
   *     or the key is {@code null}
   */
  boolean markCompleted(String handlerId, String key);
}
