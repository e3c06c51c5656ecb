package eventbus;

import com.github.f4b6a3.ulid.UlidCreator;

import java.util.Objects;

/**
 * Registration record binding an {@link EventHandler} to an event name, together with the
 * policies the bus applies when dispatching to it.
 *
 * <p>A registration is identified by {@code (eventName, module, handlerId)}. Registering a
 * second descriptor with the same identity replaces the first. When no handler id is given,
 * one is generated ({@code <module>-<ulid>}) and the registration is therefore unique.
 *
 * <p>{@code retryPolicy} and {@code timeoutMs} are optional; when unset, the bus defaults
 * apply at dispatch time. A {@link PayloadValidator} is optional as well.
 *
 * <pre>{@code
 * HandlerDescriptor.builder("projects:project.created")
 *     .module("tasks")
 *     .handlerId("tasks-project-created-handler")
 *     .handler(event -> createInitialTask(event))
 *     .retryPolicy(new RetryPolicy(3, 1000, true))
 *     .timeoutMs(10_000)
 *     .idempotencyKey(event -> "task-created-for-project-" + projectId(event))
 *     .build();
 * }</pre>
 *
 * @see eventbus.registry.HandlerRegistry
 */
public final class HandlerDescriptor {
  private final String eventName;
  private final String module;
  private final String handlerId;
  private final EventHandler handler;
  private final RetryPolicy retryPolicy;
  private final Long timeoutMs;
  private final IdempotencyKeyFunction idempotencyKey;
  private final PayloadValidator validator;

  private HandlerDescriptor(Builder builder) {
    this.eventName = Objects.requireNonNull(builder.eventName, "eventName");
    if (this.eventName.isEmpty()) {
      throw new IllegalArgumentException("eventName cannot be empty");
    }
    this.module = Objects.requireNonNull(builder.module, "module");
    if (this.module.isEmpty()) {
      throw new IllegalArgumentException("module cannot be empty");
    }
    this.handler = Objects.requireNonNull(builder.handler, "handler");
    this.handlerId = builder.handlerId == null || builder.handlerId.isEmpty()
        ? module + "-" + UlidCreator.getMonotonicUlid().toString().toLowerCase()
        : builder.handlerId;
    this.retryPolicy = builder.retryPolicy;
    this.timeoutMs = builder.timeoutMs;
    this.idempotencyKey = builder.idempotencyKey;
    this.validator = builder.validator;
  }

  public static Builder builder(String eventName) {
    return new Builder(eventName);
  }

  public String eventName() {
    return eventName;
  }

  public String module() {
    return module;
  }

  public String handlerId() {
    return handlerId;
  }

  public EventHandler handler() {
    return handler;
  }

  /**
   * @return the handler's retry policy, or {@code null} to use the bus default
   */
  public RetryPolicy retryPolicy() {
    return retryPolicy;
  }

  /**
   * @return the per-attempt timeout in milliseconds, or {@code null} to use the bus default
   */
  public Long timeoutMs() {
    return timeoutMs;
  }

  /**
   * @return the idempotency key function, or {@code null} if the handler always runs
   */
  public IdempotencyKeyFunction idempotencyKey() {
    return idempotencyKey;
  }

  /**
   * @return the payload validator, or {@code null} if payloads are not checked
   */
  public PayloadValidator validator() {
    return validator;
  }

  /**
   * Returns {@code true} if {@code other} identifies the same registration, i.e. has the same
   * event name, module and handler id.
   *
   * @param other the descriptor to compare
   * @return whether both descriptors share an identity
   */
  public boolean sameRegistrationAs(HandlerDescriptor other) {
    return eventName.equals(other.eventName)
        && module.equals(other.module)
        && handlerId.equals(other.handlerId);
  }

  @Override
  public String toString() {
    return "HandlerDescriptor{eventName=" + eventName
        + ", module=" + module
        + ", handlerId=" + handlerId + '}';
  }

  /**
   * Builder for {@link HandlerDescriptor}.
   */
  public static final class Builder {
    private final String eventName;
    private String module;
    private String handlerId;
    private EventHandler handler;
    private RetryPolicy retryPolicy;
    private Long timeoutMs;
    private IdempotencyKeyFunction idempotencyKey;
    private PayloadValidator validator;

    private Builder(String eventName) {
      this.eventName = eventName;
    }

    /**
     * Sets the module that owns the handler.
     *
     * <p><b>Required.</b>
     *
     * @param module the owning module name
     * @return this builder
     */
    public Builder module(String module) {
      this.module = module;
      return this;
    }

    /**
     * Sets a stable handler identifier, unique within the module for this event.
     *
     * <p>Optional. Defaults to a generated {@code <module>-<ulid>} id. A stable id is needed for
     * replace-on-reregister and for idempotency records to survive a restart.
     *
     * @param handlerId the handler identifier
     * @return this builder
     */
    public Builder handlerId(String handlerId) {
      this.handlerId = handlerId;
      return this;
    }

    /**
     * Sets the handler function.
     *
     * <p><b>Required.</b>
     *
     * @param handler the handler
     * @return this builder
     */
    public Builder handler(EventHandler handler) {
      this.handler = handler;
      return this;
    }

    /**
     * Sets the retry policy.
     *
     * <p>Optional. Defaults to the bus-wide default policy.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the per-attempt timeout.
     *
     * <p>Optional. Defaults to the bus-wide default timeout.
     *
     * @param timeoutMs timeout in milliseconds
     * @return this builder
     */
    public Builder timeoutMs(long timeoutMs) {
      this.timeoutMs = timeoutMs;
      return this;
    }

    /**
     * Sets the idempotency key function.
     *
     * <p>Optional. Without one the handler runs on every delivery.
     *
     * @param idempotencyKey the key function
     * @return this builder
     */
    public Builder idempotencyKey(IdempotencyKeyFunction idempotencyKey) {
      this.idempotencyKey = idempotencyKey;
      return this;
    }

    /**
     * Sets a check the payload must pass before the handler runs.
     *
     * @param validator the validator, or {@code null} for none
     * @return this builder
     */
    public Builder validator(PayloadValidator validator) {
      this.validator = validator;
      return this;
    }

    /**
     * Builds the descriptor. Policy values are checked on registration, not here.
     *
     * @return a new descriptor
     * @throws NullPointerException     if {@code eventName}, {@code module} or {@code handler} is null
     * @throws IllegalArgumentException if {@code eventName} or {@code module} is empty
     */
    public HandlerDescriptor build() {
      return new HandlerDescriptor(this);
    }
  }
}
