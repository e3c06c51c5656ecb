package eventbus.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Proof that a handler completed its side effect for an idempotency key.
 *
 * <p>At most one record exists per {@code (handlerId, key)} pair. Records are never updated.
 *
 * @param handlerId   the handler that completed
 * @param key         the idempotency key derived from the event
 * @param completedAt when the completion was recorded
 */
public record IdempotencyRecord(String handlerId, String key, Instant completedAt) {

  public IdempotencyRecord {
    Objects.requireNonNull(handlerId, "handlerId");
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(completedAt, "completedAt");
  }
}
