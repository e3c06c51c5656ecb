package eventbus.jdbc;

import java.sql.SQLException;

/**
 * A completion record could not be read or written. The dispatcher treats this like any other
 * store failure: a failed check fails the attempt, a failed record is logged.
 */
public final class IdempotencyStoreException extends RuntimeException {
  private final String handlerId;
  private final String idempotencyKey;

  IdempotencyStoreException(String action, String handlerId, String idempotencyKey,
      SQLException cause) {
    super("Failed to " + action
        + (handlerId == null ? "" : " for handler=" + handlerId + ", key=" + idempotencyKey)
        + (cause.getSQLState() == null ? "" : " (SQLState " + cause.getSQLState() + ")"), cause);
    this.handlerId = handlerId;
    this.idempotencyKey = idempotencyKey;
  }

  /** Handler whose record was involved; {@code null} for bulk operations such as purges. */
  public String handlerId() {
    return handlerId;
  }

  public String idempotencyKey() {
    return idempotencyKey;
  }
}
