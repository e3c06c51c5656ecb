package eventbus.dispatch;

/**
 * Tracks which {@code (handlerId, idempotencyKey)} pairs are being processed right now, so two
 * dispatches for the same business operation never run a handler concurrently.
 */
public interface InFlightTracker {
  /**
   * Claims a key for one handler.
   *
   * @return {@code true} if the claim succeeded, {@code false} if another dispatch holds it
   */
  boolean tryAcquire(String handlerId, String idempotencyKey);

  void release(String handlerId, String idempotencyKey);

  boolean isInFlight(String handlerId, String idempotencyKey);
}
