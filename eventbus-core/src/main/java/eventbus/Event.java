package eventbus;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain event broadcast by the {@link EventBus} to every handler registered
 * for its {@linkplain #name() name}.
 *
 * <p>Each event is assigned a ULID-based {@code eventId} when it is built. The id identifies
 * the publish call, not the business operation: two publishes for the same project carry two
 * different event ids, and handlers that must not repeat a side effect derive an
 * {@linkplain IdempotencyKeyFunction idempotency key} from the {@linkplain #data() payload}
 * instead.
 *
 * @see EventBus#publish(String, Object, String)
 * @see HandlerDescriptor
 */
public final class Event {
  public static final String DEFAULT_VERSION = "v1";

  private final String eventId;
  private final String name;
  private final Object data;
  private final String sourceModule;
  private final Instant occurredAt;
  private final String correlationId;
  private final String version;

  private Event(Builder builder) {
    this.name = Objects.requireNonNull(builder.name, "name");
    if (this.name.isEmpty()) {
      throw new IllegalArgumentException("name cannot be empty");
    }
    this.sourceModule = Objects.requireNonNull(builder.sourceModule, "sourceModule");
    if (this.sourceModule.isEmpty()) {
      throw new IllegalArgumentException("sourceModule cannot be empty");
    }
    this.eventId = builder.eventId == null ? newEventId() : builder.eventId;
    this.data = builder.data;
    this.occurredAt = builder.occurredAt == null ? Instant.now() : builder.occurredAt;
    this.correlationId = builder.correlationId == null ? this.eventId : builder.correlationId;
    this.version = builder.version == null ? DEFAULT_VERSION : builder.version;
  }

  /**
   * Creates a builder for an event with the given name.
   *
   * @param name the event name, conventionally {@code module:action}
   * @return a new builder
   */
  public static Builder builder(String name) {
    return new Builder(name);
  }

  public String eventId() {
    return eventId;
  }

  public String name() {
    return name;
  }

  /**
   * Returns the payload exactly as it was published. May be {@code null}.
   *
   * @return the payload
   */
  public Object data() {
    return data;
  }

  /**
   * Returns the payload cast to the given type.
   *
   * @param type expected payload type
   * @param <T>  payload type
   * @return the payload, or {@code null} if none was published
   * @throws ClassCastException if the payload is not an instance of {@code type}
   */
  public <T> T dataAs(Class<T> type) {
    Objects.requireNonNull(type, "type");
    return type.cast(data);
  }

  public String sourceModule() {
    return sourceModule;
  }

  public Instant occurredAt() {
    return occurredAt;
  }

  /**
   * Returns the correlation id used to trace a chain of events. Defaults to this
   * event's own {@link #eventId()} when the publisher did not supply one.
   *
   * @return the correlation id, never {@code null}
   */
  public String correlationId() {
    return correlationId;
  }

  public String version() {
    return version;
  }

  @Override
  public String toString() {
    return "Event{eventId=" + eventId
        + ", name=" + name
        + ", sourceModule=" + sourceModule
        + ", occurredAt=" + occurredAt + '}';
  }

  /**
   * Builder for {@link Event}.
   */
  public static final class Builder {
    private final String name;
    private String eventId;
    private Object data;
    private String sourceModule;
    private Instant occurredAt;
    private String correlationId;
    private String version;

    private Builder(String name) {
      this.name = name;
    }

    /**
     * Sets a custom event identifier.
     *
     * <p>Optional. Defaults to a monotonic ULID.
     *
     * @param eventId the event identifier
     * @return this builder
     */
    public Builder eventId(String eventId) {
      this.eventId = eventId;
      return this;
    }

    /**
     * Sets the event payload.
     *
     * @param data the payload, may be {@code null}
     * @return this builder
     */
    public Builder data(Object data) {
      this.data = data;
      return this;
    }

    /**
     * Sets the module that publishes the event.
     *
     * <p><b>Required.</b>
     *
     * @param sourceModule the publishing module name
     * @return this builder
     */
    public Builder sourceModule(String sourceModule) {
      this.sourceModule = sourceModule;
      return this;
    }

    /**
     * Sets the event timestamp.
     *
     * <p>Optional. Defaults to {@link Instant#now()}.
     *
     * @param occurredAt the event timestamp
     * @return this builder
     */
    public Builder occurredAt(Instant occurredAt) {
      this.occurredAt = occurredAt;
      return this;
    }

    /**
     * Sets the correlation id.
     *
     * <p>Optional. Defaults to the event id.
     *
     * @param correlationId the correlation id
     * @return this builder
     */
    public Builder correlationId(String correlationId) {
      this.correlationId = correlationId;
      return this;
    }

    /**
     * Sets the payload schema version.
     *
     * <p>Optional. Defaults to {@value Event#DEFAULT_VERSION}.
     *
     * @param version the schema version
     * @return this builder
     */
    public Builder version(String version) {
      this.version = version;
      return this;
    }

    /**
     * Builds an immutable {@link Event}.
     *
     * @return a new event
     * @throws NullPointerException     if {@code name} or {@code sourceModule} is null
     * @throws IllegalArgumentException if {@code name} or {@code sourceModule} is empty
     */
    public Event build() {
      return new Event(this);
    }
  }

  private static String newEventId() {
    return UlidCreator.getMonotonicUlid().toString();
  }
}
