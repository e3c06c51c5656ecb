package eventbus.dispatch;

import eventbus.Event;
import eventbus.HandlerDescriptor;
import eventbus.RetryPolicy;
import eventbus.idempotency.InMemoryIdempotencyStore;
import eventbus.model.DeliveryOutcome;
import eventbus.spi.IdempotencyStore;
import eventbus.spi.MetricsExporter;
import eventbus.util.DaemonThreadFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Delivers one event to one handler, applying idempotency, circuit breaking, per-attempt
 * timeouts and retries.
 *
 * <p>Each {@link #dispatch} starts an independent state machine:
 * <ol>
 *   <li>Resolve the idempotency key. With a key, claim it in the {@link InFlightTracker};
 *       if another dispatch holds it, re-check after {@code inFlightRecheckMs} without using
 *       an attempt.</li>
 *   <li>Per attempt: skip if the key already completed (first attempt, or after the check
 *       itself failed), ask the {@link CircuitBreaker}, run the interceptors and the handler on
 *       the worker pool under a timer of {@code timeoutMs}.</li>
 *   <li>On success record the key as completed; on failure or timeout schedule the next
 *       attempt through the {@link RetryScheduler}, or give up once the policy is used up.</li>
 * </ol>
 *
 * <p>No thread ever sleeps: backoff and timeouts are timer tasks. Failures are logged,
 * counted and handed to interceptors; nothing propagates to the caller of {@code dispatch}.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe and implements
 * {@link AutoCloseable} for graceful shutdown with a configurable drain timeout.
 */
public final class HandlerDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(HandlerDispatcher.class.getName());

  public static final long DEFAULT_TIMEOUT_MS = 30_000;
  public static final long DEFAULT_IN_FLIGHT_RECHECK_MS = 50;
  public static final long DEFAULT_DRAIN_TIMEOUT_MS = 5_000;

  private final ExecutorService workers;
  private final boolean ownsWorkers;
  private final RetryScheduler scheduler;
  private final IdempotencyStore idempotencyStore;
  private final InFlightTracker inFlightTracker;
  private final CircuitBreaker circuitBreaker;
  private final MetricsExporter metrics;
  private final List<HandlerInterceptor> interceptors;
  private final RetryPolicy defaultRetryPolicy;
  private final long defaultTimeoutMs;
  private final long inFlightRecheckMs;
  private final long drainTimeoutMs;

  private final AtomicBoolean accepting = new AtomicBoolean(true);
  private final AtomicInteger inFlight = new AtomicInteger();
  private final Object drainLock = new Object();

  private HandlerDispatcher(Builder builder) {
    this.idempotencyStore = builder.idempotencyStore != null
        ? builder.idempotencyStore : new InMemoryIdempotencyStore();
    this.inFlightTracker = builder.inFlightTracker != null
        ? builder.inFlightTracker : new DefaultInFlightTracker();
    this.circuitBreaker = builder.circuitBreaker != null
        ? builder.circuitBreaker : new CircuitBreaker();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.interceptors = Collections.unmodifiableList(new ArrayList<>(builder.interceptors));
    this.defaultRetryPolicy = Objects.requireNonNull(builder.defaultRetryPolicy, "defaultRetryPolicy");
    if (defaultRetryPolicy.maxAttempts() < 1 || defaultRetryPolicy.backoffMs() < 0) {
      throw new IllegalArgumentException("Invalid default retry policy: " + defaultRetryPolicy);
    }
    if (builder.defaultTimeoutMs <= 0) {
      throw new IllegalArgumentException("defaultTimeoutMs must be > 0, got: " + builder.defaultTimeoutMs);
    }
    if (builder.inFlightRecheckMs <= 0) {
      throw new IllegalArgumentException("inFlightRecheckMs must be > 0, got: " + builder.inFlightRecheckMs);
    }
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0, got: " + builder.drainTimeoutMs);
    }
    this.defaultTimeoutMs = builder.defaultTimeoutMs;
    this.inFlightRecheckMs = builder.inFlightRecheckMs;
    this.drainTimeoutMs = builder.drainTimeoutMs;
    this.scheduler = new RetryScheduler(builder.maxDelayMs);
    if (builder.workers != null) {
      this.workers = builder.workers;
      this.ownsWorkers = false;
    } else {
      this.workers = Executors.newCachedThreadPool(new DaemonThreadFactory("eventbus-worker-"));
      this.ownsWorkers = true;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts delivering {@code event} to {@code handler} and returns once the delivery has been
   * handed to the worker pool.
   *
   * @param event   the event
   * @param handler the target handler
   * @throws IllegalStateException if the dispatcher is closed
   */
  public void dispatch(Event event, HandlerDescriptor handler) {
    Objects.requireNonNull(event, "event");
    Objects.requireNonNull(handler, "handler");
    if (!accepting.get()) {
      throw new IllegalStateException("Dispatcher is closed");
    }
    Dispatch dispatch = new Dispatch(event, handler);
    metrics.recordInFlight(inFlight.incrementAndGet());
    try {
      workers.execute(dispatch::begin);
    } catch (RejectedExecutionException e) {
      logger.log(Level.SEVERE, "Worker pool rejected dispatch of " + event.name()
          + " to handler " + handler.handlerId(), e);
      finished();
    }
  }

  /**
   * @return dispatches started and not yet finished, scheduled retries included
   */
  public int inFlightDispatches() {
    return inFlight.get();
  }

  /**
   * Blocks until no dispatch is in flight or the timeout elapses.
   *
   * @return {@code true} if the dispatcher became idle
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitIdle(long timeout, TimeUnit unit) throws InterruptedException {
    long deadline = System.nanoTime() + unit.toNanos(timeout);
    synchronized (drainLock) {
      while (inFlight.get() > 0) {
        long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
        if (remainingMs <= 0) {
          return false;
        }
        drainLock.wait(remainingMs);
      }
    }
    return true;
  }

  public CircuitBreaker circuitBreaker() {
    return circuitBreaker;
  }

  public RetryScheduler retryScheduler() {
    return scheduler;
  }

  public IdempotencyStore idempotencyStore() {
    return idempotencyStore;
  }

  public MetricsExporter metrics() {
    return metrics;
  }

  /**
   * Initiates graceful shutdown: stops accepting dispatches, waits up to the drain timeout for
   * in-flight dispatches (pending retries included), then stops the timer and the worker pool.
   */
  @Override
  public void close() {
    if (!accepting.getAndSet(false)) {
      return;
    }
    try {
      if (!awaitIdle(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; forcing shutdown with "
            + inFlight.get() + " dispatch(es) in flight");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } finally {
      scheduler.close();
      if (ownsWorkers) {
        workers.shutdownNow();
      }
    }
  }

  private void finished() {
    int remaining = inFlight.decrementAndGet();
    metrics.recordInFlight(remaining);
    if (remaining == 0) {
      synchronized (drainLock) {
        drainLock.notifyAll();
      }
    }
  }

  /** State of one event delivery to one handler. */
  private final class Dispatch {
    private final Event event;
    private final HandlerDescriptor handler;
    private final RetryPolicy policy;
    private final long timeoutMs;
    private final String circuitKey;
    private String idempotencyKey;
    private volatile boolean claimed;
    private volatile boolean checked;
    private int attempts;

    Dispatch(Event event, HandlerDescriptor handler) {
      this.event = event;
      this.handler = handler;
      this.policy = handler.retryPolicy() != null ? handler.retryPolicy() : defaultRetryPolicy;
      this.timeoutMs = handler.timeoutMs() != null ? handler.timeoutMs() : defaultTimeoutMs;
      this.circuitKey = handler.module() + ":" + handler.handlerId();
    }

    void begin() {
      if (handler.idempotencyKey() != null) {
        try {
          idempotencyKey = handler.idempotencyKey().keyFor(event);
        } catch (RuntimeException e) {
          giveUp(new HandlerException(event, handler, 0, "Idempotency key function failed", e));
          return;
        }
      }
      claimAndAttempt();
    }

    void claimAndAttempt() {
      if (idempotencyKey != null && !claimed) {
        if (!inFlightTracker.tryAcquire(handler.handlerId(), idempotencyKey)) {
          metrics.incrementDispatchDeferred();
          logger.fine(() -> "Key " + idempotencyKey + " in flight for handler "
              + handler.handlerId() + "; deferring event " + event.eventId());
          later(inFlightRecheckMs, this::claimAndAttempt);
          return;
        }
        claimed = true;
      }
      attempt();
    }

    void attempt() {
      int attemptNumber = ++attempts;
      Instant startedAt = Instant.now();
      long startNanos = System.nanoTime();
      AtomicInteger completedBefore = new AtomicInteger();
      CompletableFuture<Boolean> result = new CompletableFuture<>();
      Future<?> task;
      try {
        task = workers.submit(() -> {
          try {
            result.complete(runAttempt(attemptNumber, completedBefore, result));
          } catch (Throwable t) {
            result.completeExceptionally(t);
          }
        });
      } catch (RejectedExecutionException e) {
        logger.log(Level.WARNING, "Worker pool rejected attempt " + attemptNumber
            + " for handler " + handler.handlerId() + "; dropping event " + event.eventId(), e);
        finish();
        return;
      }
      ScheduledFuture<?> timer;
      try {
        timer = scheduler.schedule(timeoutMs, () -> {
          if (result.completeExceptionally(
              new HandlerTimeoutException(event, handler, attemptNumber, timeoutMs))) {
            task.cancel(true);
          }
        });
      } catch (RejectedExecutionException e) {
        // Closing: the attempt still runs, only without a timeout
        timer = null;
      }
      ScheduledFuture<?> timeout = timer;
      result.whenCompleteAsync((ran, error) -> {
        if (timeout != null) {
          timeout.cancel(false);
        }
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        onAttemptDone(attemptNumber, startedAt, durationMs, completedBefore.get(), ran, error);
      }, workers);
    }

    /**
     * Body of one attempt. Once {@code result} is done the attempt has timed out and its outcome
     * is already recorded, so it must not take a circuit permit or run the handler.
     *
     * @return {@code false} if the key was already processed
     */
    private boolean runAttempt(int attemptNumber, AtomicInteger completedBefore,
        CompletableFuture<Boolean> result) throws Exception {
      if (idempotencyKey != null && !checked) {
        if (idempotencyStore.hasCompleted(handler.handlerId(), idempotencyKey)) {
          return false;
        }
        checked = true;
      }
      if (result.isDone()) {
        return false;
      }
      if (handler.validator() != null) {
        try {
          handler.validator().validate(event);
        } catch (RuntimeException e) {
          throw new InvalidPayloadException(event, handler, attemptNumber, e);
        }
      }
      CircuitBreaker.Permit permit = circuitBreaker.acquire(circuitKey);
      if (!permit.permitted()) {
        throw new CircuitOpenException(event, handler, attemptNumber);
      }
      boolean invoked = false;
      try {
        for (HandlerInterceptor interceptor : interceptors) {
          interceptor.beforeAttempt(event, handler, attemptNumber);
          completedBefore.incrementAndGet();
        }
        // Abandoned while the check or an interceptor ran
        if (result.isDone()) {
          return false;
        }
        invoked = true;
        handler.handler().handle(event);
        return true;
      } finally {
        // A trial taken by an attempt whose outcome nobody records would wedge the circuit
        if (!invoked && permit == CircuitBreaker.Permit.TRIAL && result.isDone()) {
          circuitBreaker.releaseTrial(circuitKey);
        }
      }
    }

    private void onAttemptDone(int attemptNumber, Instant startedAt, long durationMs,
        int completedBefore, Boolean ran, Throwable error) {
      if (error == null && Boolean.FALSE.equals(ran)) {
        metrics.incrementHandlerSkipped();
        logger.fine(() -> "Skipped handler " + handler.handlerId() + " for event "
            + event.eventId() + ": key " + idempotencyKey + " already processed");
        finish();
        return;
      }
      metrics.recordHandlerDurationMs(durationMs);

      if (error == null) {
        circuitBreaker.recordSuccess(circuitKey);
        metrics.incrementHandlerSuccess();
        runAfterAttempt(new DeliveryAttempt(handler, event, attemptNumber, startedAt, durationMs,
            DeliveryOutcome.SUCCESS), null, completedBefore);
        markCompleted();
        logger.fine(() -> "Handler " + handler.handlerId() + " processed event "
            + event.eventId() + " on attempt " + attemptNumber);
        finish();
        return;
      }

      HandlerException failure = toHandlerException(error, attemptNumber);
      DeliveryOutcome outcome;
      if (failure instanceof HandlerTimeoutException) {
        outcome = DeliveryOutcome.TIMEOUT;
        metrics.incrementHandlerTimeout();
      } else {
        outcome = DeliveryOutcome.FAILURE;
        metrics.incrementHandlerFailure();
      }
      if (failure instanceof CircuitOpenException) {
        metrics.incrementCircuitOpen();
      } else if (!(failure instanceof InvalidPayloadException)) {
        circuitBreaker.recordFailure(circuitKey);
      }
      runAfterAttempt(new DeliveryAttempt(handler, event, attemptNumber, startedAt, durationMs,
          outcome), failure, completedBefore);

      if (!(failure instanceof InvalidPayloadException)
          && scheduler.shouldRetry(policy, attemptNumber, outcome)) {
        long delayMs = scheduler.nextDelay(policy, attemptNumber);
        metrics.incrementRetryScheduled();
        logger.log(Level.WARNING, failure.getMessage() + "; retrying in " + delayMs + "ms",
            failure.getCause() != null ? failure.getCause() : failure);
        later(delayMs, this::attempt);
      } else {
        giveUp(new HandlerExhaustedException(event, handler, attemptNumber, failure));
      }
    }

    private HandlerException toHandlerException(Throwable error, int attemptNumber) {
      Throwable cause = error instanceof CompletionException && error.getCause() != null
          ? error.getCause() : error;
      if (cause instanceof HandlerException handlerException) {
        return handlerException;
      }
      return new HandlerException(event, handler, attemptNumber, "Handler failed", cause);
    }

    private void runAfterAttempt(DeliveryAttempt attempt, HandlerException error, int count) {
      for (int i = count - 1; i >= 0; i--) {
        try {
          interceptors.get(i).afterAttempt(attempt, error);
        } catch (Exception ex) {
          logger.log(Level.WARNING, "Interceptor afterAttempt failed", ex);
        }
      }
    }

    private void markCompleted() {
      if (idempotencyKey == null) {
        return;
      }
      try {
        idempotencyStore.markCompleted(handler.handlerId(), idempotencyKey);
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Failed to record completion of key " + idempotencyKey
            + " for handler " + handler.handlerId() + "; a redelivery may run it again", e);
      }
    }

    private void giveUp(HandlerException failure) {
      metrics.incrementHandlerExhausted();
      logger.log(Level.SEVERE, failure.getMessage(), failure);
      finish();
    }

    /** Runs {@code step} on a worker after {@code delayMs}; drops the dispatch when closed. */
    private void later(long delayMs, Runnable step) {
      try {
        scheduler.schedule(delayMs, () -> {
          try {
            workers.execute(step);
          } catch (RejectedExecutionException e) {
            dropped(e);
          }
        });
      } catch (RejectedExecutionException e) {
        dropped(e);
      }
    }

    private void dropped(RejectedExecutionException e) {
      logger.log(Level.WARNING, "Event bus shut down; dropping pending delivery of event "
          + event.eventId() + " to handler " + handler.handlerId(), e);
      finish();
    }

    private void finish() {
      if (claimed) {
        claimed = false;
        inFlightTracker.release(handler.handlerId(), idempotencyKey);
      }
      finished();
    }
  }

  /** Builder for {@link HandlerDispatcher}. */
  public static final class Builder {
    private IdempotencyStore idempotencyStore;
    private InFlightTracker inFlightTracker;
    private CircuitBreaker circuitBreaker;
    private ExecutorService workers;
    private MetricsExporter metrics;
    private final List<HandlerInterceptor> interceptors = new ArrayList<>();
    private RetryPolicy defaultRetryPolicy = RetryPolicy.DEFAULT;
    private long defaultTimeoutMs = DEFAULT_TIMEOUT_MS;
    private long maxDelayMs = RetryScheduler.DEFAULT_MAX_DELAY_MS;
    private long inFlightRecheckMs = DEFAULT_IN_FLIGHT_RECHECK_MS;
    private long drainTimeoutMs = DEFAULT_DRAIN_TIMEOUT_MS;

    private Builder() {}

    /**
     * Sets the store recording completed idempotency keys.
     *
     * <p>Optional. Defaults to {@link InMemoryIdempotencyStore}.
     *
     * @param idempotencyStore the store
     * @return this builder
     */
    public Builder idempotencyStore(IdempotencyStore idempotencyStore) {
      this.idempotencyStore = idempotencyStore;
      return this;
    }

    /**
     * Sets the tracker that serializes dispatches sharing an idempotency key.
     *
     * <p>Optional. Defaults to {@link DefaultInFlightTracker}.
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
     * <p>Optional. Defaults to a breaker opening after 5 consecutive failures for 30 seconds.
     * Use {@link CircuitBreaker#disabled()} to turn it off.
     *
     * @param circuitBreaker the circuit breaker
     * @return this builder
     */
    public Builder circuitBreaker(CircuitBreaker circuitBreaker) {
      this.circuitBreaker = circuitBreaker;
      return this;
    }

    /**
     * Sets the executor handlers run on. An executor supplied here is not shut down by
     * {@link #close()}.
     *
     * <p>Optional. Defaults to a cached pool of daemon threads named {@code eventbus-worker-N}.
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
     * Adds an interceptor. Interceptors run in the order added.
     *
     * @param interceptor the interceptor
     * @return this builder
     */
    public Builder interceptor(HandlerInterceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return this;
    }

    /**
     * Adds several interceptors, in list order.
     *
     * @param interceptors the interceptors
     * @return this builder
     */
    public Builder interceptors(List<HandlerInterceptor> interceptors) {
      for (HandlerInterceptor interceptor : interceptors) {
        interceptor(interceptor);
      }
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
      this.defaultRetryPolicy = defaultRetryPolicy;
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
     * Sets how long a dispatch waits before re-checking a key another dispatch holds.
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
     * Sets the maximum time to wait for in-flight dispatches during shutdown.
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

    public HandlerDispatcher build() {
      return new HandlerDispatcher(this);
    }
  }
}
