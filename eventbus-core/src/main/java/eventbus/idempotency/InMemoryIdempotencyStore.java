package eventbus.idempotency;

import eventbus.model.IdempotencyRecord;
import eventbus.spi.IdempotencyStore;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ConcurrentHashMap}-based idempotency store that lives as long as the process.
 *
 * <p>Records are never evicted: the bus carries low-volume administrative events, so the map
 * grows by one entry per completed business operation. Completion state is lost on restart;
 * use the JDBC store from {@code eventbus-jdbc} where de-duplication must survive one.
 *
 * <p>This class is thread-safe. {@link #markCompleted} relies on
 * {@link Map#putIfAbsent} so concurrent marks of the same pair create one record.
 */
public final class InMemoryIdempotencyStore implements IdempotencyStore {
  private final Map<Key, IdempotencyRecord> records = new ConcurrentHashMap<>();
  private final Clock clock;

  public InMemoryIdempotencyStore() {
    this(Clock.systemUTC());
  }

  public InMemoryIdempotencyStore(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public boolean hasCompleted(String handlerId, String key) {
    if (key == null) {
      return false;
    }
    return records.containsKey(new Key(handlerId, key));
  }

  @Override
  public boolean markCompleted(String handlerId, String key) {
    if (key == null) {
      return false;
    }
    Objects.requireNonNull(handlerId, "handlerId");
    IdempotencyRecord record = new IdempotencyRecord(handlerId, key, clock.instant());
    return records.putIfAbsent(new Key(handlerId, key), record) == null;
  }

  /**
   * Returns the completion record for a pair, if any.
   *
   * @param handlerId the handler identifier
   * @param key       the idempotency key
   * @return the record, or empty if the pair has not completed
   */
  public Optional<IdempotencyRecord> find(String handlerId, String key) {
    if (handlerId == null || key == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(records.get(new Key(handlerId, key)));
  }

  public int size() {
    return records.size();
  }

  private record Key(String handlerId, String key) {
  }
}
