package eventbus.dispatch;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ConcurrentHashMap}-based in-flight tracker scoped to a single process.
 *
 * <p>A claim lasts until {@link #release} is called. The dispatcher releases its claim only
 * after the handler finished and, on success, the key was recorded as completed, so a
 * deferred dispatch that acquires the claim afterwards sees the completion.
 *
 * <p>This class is thread-safe.
 */
public final class DefaultInFlightTracker implements InFlightTracker {
  private final Map<Claim, Instant> claims = new ConcurrentHashMap<>();

  @Override
  public boolean tryAcquire(String handlerId, String idempotencyKey) {
    return claims.putIfAbsent(new Claim(handlerId, idempotencyKey), Instant.now()) == null;
  }

  @Override
  public void release(String handlerId, String idempotencyKey) {
    claims.remove(new Claim(handlerId, idempotencyKey));
  }

  @Override
  public boolean isInFlight(String handlerId, String idempotencyKey) {
    return claims.containsKey(new Claim(handlerId, idempotencyKey));
  }

  /**
   * @return number of keys currently claimed
   */
  public int size() {
    return claims.size();
  }

  private record Claim(String handlerId, String idempotencyKey) {
  }
}
