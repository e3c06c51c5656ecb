package eventbus;

import eventbus.dispatch.CircuitBreaker;
import eventbus.dispatch.HandlerDispatcher;
import eventbus.dispatch.HandlerInterceptor;
import eventbus.dispatch.InFlightTracker;
import eventbus.dispatch.RetryScheduler;
import eventbus.registry.DefaultHandlerRegistry;
import eventbus.registry.HandlerRegistry;
import eventbus.spi.IdempotencyStore;
import eventbus.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process publish/subscribe bus connecting modules through named events.
 *
 * <p>{@link #publish} is fire-and-forget: it builds the {@link Event}, starts one independent
 * dispatch per registered handler and returns without waiting for any handler. Handler
 * failures are retried, logged and counted by the {@link HandlerDispatcher}; they never reach
 * the publisher or affect other handlers of the same event.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * HandlerRegistry registry = new DefaultHandlerRegistry();
 * try (EventBus bus = EventBus.builder()
 *     .registry(registry)
 *     .defaultTimeoutMs(10_000)
 *     .build()) {
 *   new BootstrapLoader(registry, modules).bootstrapEventHandlers();
 *   bus.publish("projects:project.created", projectCreated, "projects");
 * }
 * }</pre>
 *
 * @see HandlerDispatcher
 * @see eventbus.bootstrap.BootstrapLoader
 */
public final class EventBus implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(EventBus.class.getName());

  private final HandlerRegistry registry;
  private final HandlerDispatcher dispatcher;
  private final MetricsExporter metrics;
  private final boolean enabled;
  private final AtomicBoolean open = new AtomicBoolean(true);

  private EventBus(Builder builder) {
    this.registry = builder.registry != null ? builder.registry : new DefaultHandlerRegistry();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.enabled = builder.enabled;
    HandlerDispatcher.Builder dispatcherBuilder = HandlerDispatcher.builder()
        .idempotencyStore(builder.idempotencyStore)
        .inFlightTracker(builder.inFlightTracker)
        .workers(builder.workers)
        .metrics(metrics)
        .interceptors(builder.interceptors)
        .defaultRetryPolicy(builder.defaultRetryPolicy)
        .defaultTimeoutMs(builder.defaultTimeoutMs)
        .maxDelayMs(builder.maxDelayMs)
        .inFlightRecheckMs(builder.inFlightRecheckMs)
        .drainTimeoutMs(builder.drainTimeoutMs);
    if (builder.circuitBreaker != null) {
      dispatcherBuilder.circuitBreaker(builder.circuitBreaker);
    }
    this.dispatcher = dispatcherBuilder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Publishes an event to every handler registered for {@code eventName}.
   *
   * @param eventName    the event name, conventionally {@code module:action}
   * @param data         the payload, may be {@code null}
   * @param sourceModule the publishing module
   * @return the published event
   * @throws NullPointerException     if {@code eventName} or {@code sourceModule} is null
   * @throws IllegalArgumentException if {@code eventName} or {@code sourceModule} is empty
   * @throws IllegalStateException    if the bus is closed
   */
  public Event publish(String eventName, Object data, String sourceModule) {
    return publish(eventName, data, sourceModule, null);
  }

  /**
   * Publishes an event carrying a caller-supplied correlation id.
   *
   * @param correlationId the correlation id, or {@code null} to use the event id
   * @see #publish(String, Object, String)
   */
  public Event publish(String eventName, Object data, String sourceModule, String correlationId) {
    return publish(Event.builder(eventName)
        .data(data)
        .sourceModule(sourceModule)
        .correlationId(correlationId)
        .build());
  }

  /**
   * Publishes a pre-built event.
   *
   * @param event the event
   * @return the same event
   * @throws IllegalStateException if the bus is closed
   */
  public Event publish(Event event) {
    Objects.requireNonNull(event, "event");
    if (!open.get()) {
      throw new IllegalStateException("EventBus is closed");
    }
    if (!enabled) {
      logger.log(Level.WARNING, "Event bus disabled; dropping event {0} from {1}",
          new Object[] {event.name(), event.sourceModule()});
      return event;
    }
    metrics.incrementPublished();
    List<HandlerDescriptor> handlers = registry.lookup(event.name());
    if (handlers.isEmpty()) {
      metrics.incrementNoSubscriber();
      logger.fine(() -> "No handler registered for " + event.name());
      return event;
    }
    for (HandlerDescriptor handler : handlers) {
      try {
        dispatcher.dispatch(event, handler);
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Failed to start dispatch of " + event.name()
            + " to handler " + handler.handlerId(), e);
      }
    }
    logger.fine(() -> "Published " + event + " to " + handlers.size() + " handler(s)");
    return event;
  }

  public HandlerRegistry registry() {
    return registry;
  }

  public HandlerDispatcher dispatcher() {
    return dispatcher;
  }

  public boolean isEnabled() {
    return enabled;
  }

  /**
   * @return dispatches started and not yet finished, scheduled retries included
   */
  public int inFlightDispatches() {
    return dispatcher.inFlightDispatches();
  }

  /**
   * Blocks until every started dispatch has finished or the timeout elapses.
   *
   * @return {@code true} if the bus became idle
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitIdle(long timeout, TimeUnit unit) throws InterruptedException {
    return dispatcher.awaitIdle(timeout, unit);
  }

  /**
   * Stops accepting publishes and drains in-flight dispatches, then closes the metrics
   * exporter if it is {@link AutoCloseable}.
   */
  @Override
  public void close() {
    if (!open.getAndSet(false)) {
      return;
    }
    RuntimeException first = null;
    try {
      dispatcher.close();
    } catch (RuntimeException e) {
      first = e;
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link EventBus}. */
  public static final class Builder {
    private HandlerRegistry registry;
    private IdempotencyStore idempotencyStore;
    private InFlightTracker inFlightTracker;
    private CircuitBreaker circuitBreaker;
    private ExecutorService workers;
    private MetricsExporter metrics;
    private final List<HandlerInterceptor> interceptors = new ArrayList<>();
    private boolean enabled = true;
    private RetryPolicy defaultRetryPolicy = RetryPolicy.DEFAULT;
    private long defaultTimeoutMs = HandlerDispatcher.DEFAULT_TIMEOUT_MS;
    private long maxDelayMs = RetryScheduler.DEFAULT_MAX_DELAY_MS;
    private long inFlightRecheckMs = HandlerDispatcher.DEFAULT_IN_FLIGHT_RECHECK_MS;
    private long drainTimeoutMs = HandlerDispatcher.DEFAULT_DRAIN_TIMEOUT_MS;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /**
     * Sets the handler registry read on every publish.
     *
     * <p>Optional. Defaults to a new {@link DefaultHandlerRegistry}, reachable through
     * {@link EventBus#registry()}.
     *
     * @param registry the handler registry
     * @return this builder
     */
    public Builder registry(HandlerRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Sets the idempotency store.
     *
     * <p>Optional. Defaults to an in-memory store.
     *
     * @param idempotencyStore the store
     * @return this builder
     */
    public Builder idempotencyStore(IdempotencyStore idempotencyStore) {
      this.idempotencyStore = idempotencyStore;
      return this;
    }

    /**
     * Sets the in-flight tracker.
     *
     * <p>Optional. Defaults to a process-local tracker.
     *
     * @param inFlightTracker the tracker
     * @return this builder
     */
    public Builder inFlightTracker(InFlightTracker inFlightTracker) {
      this.inFlightTracker = inFlightTracker;
      return this;
    }

    /**
     * Sets the circuit breaker.
     *
     * <p>Optional. Defaults to 5 consecutive failures, 30 second recovery.
     *
     * @param circuitBreaker the circuit breaker
     * @return this builder
     */
    public Builder circuitBreaker(CircuitBreaker circuitBreaker) {
      this.circuitBreaker = circuitBreaker;
      return this;
    }

    /**
     * Sets the executor handlers run on. It is not shut down when the bus closes.
     *
     * <p>Optional. Defaults to a cached daemon pool owned by the bus.
     *
     * @param workers the worker executor
     * @return this builder
     */
    public Builder workers(ExecutorService workers) {
      this.workers = workers;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Adds an attempt interceptor.
     *
     * @param interceptor the interceptor
     * @return this builder
     */
    public Builder interceptor(HandlerInterceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return this;
    }

    /**
     * Enables or disables delivery. A disabled bus logs and drops every publish.
     *
     * <p>Optional. Defaults to {@code true}.
     *
     * @param enabled whether events are delivered
     * @return this builder
     */
    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    /**
     * Sets the retry policy for handlers registered without one.
     *
     * <p>Optional. Defaults to {@link RetryPolicy#DEFAULT}.
     *
     * @param defaultRetryPolicy the fallback policy
     * @return this builder
     */
    public Builder defaultRetryPolicy(RetryPolicy defaultRetryPolicy) {
      this.defaultRetryPolicy = Objects.requireNonNull(defaultRetryPolicy, "defaultRetryPolicy");
      return this;
    }

    /**
     * Sets the per-attempt timeout for handlers registered without one.
     *
     * <p>Optional. Defaults to 30000ms.
     *
     * @param defaultTimeoutMs timeout in milliseconds
     * @return this builder
     */
    public Builder defaultTimeoutMs(long defaultTimeoutMs) {
      this.defaultTimeoutMs = defaultTimeoutMs;
      return this;
    }

    /**
     * Sets the cap for exponential backoff delays.
     *
     * <p>Optional. Defaults to 60000ms.
     *
     * @param maxDelayMs maximum delay in milliseconds
     * @return this builder
     */
    public Builder maxDelayMs(long maxDelayMs) {
      this.maxDelayMs = maxDelayMs;
      return this;
    }

    /**
     * Sets the interval at which a dispatch re-checks a key held by another dispatch.
     *
     * <p>Optional. Defaults to 50ms.
     *
     * @param inFlightRecheckMs interval in milliseconds
     * @return this builder
     */
    public Builder inFlightRecheckMs(long inFlightRecheckMs) {
      this.inFlightRecheckMs = inFlightRecheckMs;
      return this;
    }

    /**
     * Sets the maximum time {@link EventBus#close()} waits for in-flight dispatches.
     *
     * <p>Optional. Defaults to 5000ms.
     *
     * @param drainTimeoutMs drain timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Builds the bus.
     *
     * @return a new event bus
     * @throws IllegalStateException    if {@code build()} was already called on this builder
     * @throws IllegalArgumentException if a timeout or interval is not positive
     */
    public EventBus build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      return new EventBus(this);
    }
  }
}
