package eventbus.spi;

/**
 * Observability hook for exporting event bus counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of published events.
   */
  void incrementPublished();

  /**
   * Increments the count of published events that had no registered handler.
   */
  void incrementNoSubscriber();

  /**
   * Increments the count of handler attempts that completed successfully.
   */
  void incrementHandlerSuccess();

  /**
   * Increments the count of handler attempts that threw.
   */
  void incrementHandlerFailure();

  /**
   * Increments the count of handler attempts that exceeded their timeout.
   */
  void incrementHandlerTimeout();

  /**
   * Increments the count of handlers that used up every attempt.
   */
  void incrementHandlerExhausted();

  /**
   * Increments the count of retries scheduled after a failed or timed-out attempt.
   */
  default void incrementRetryScheduled() {
  }

  /**
   * Increments the count of dispatches skipped because the idempotency key already completed.
   */
  default void incrementHandlerSkipped() {
  }

  /**
   * Increments the count of dispatches deferred because the same idempotency key was in flight.
   */
  default void incrementDispatchDeferred() {
  }

  /**
   * Increments the count of attempts rejected by an open circuit breaker.
   */
  default void incrementCircuitOpen() {
  }

  /**
   * Records the number of dispatches currently in flight.
   *
   * @param inFlight dispatches started and not yet finished
   */
  void recordInFlight(int inFlight);

  /**
   * Records the time spent executing the handler for one attempt.
   *
   * @param durationMs handler execution time in milliseconds (always non-negative)
   */
  default void recordHandlerDurationMs(long durationMs) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementPublished() {
    }

    @Override
    public void incrementNoSubscriber() {
    }

    @Override
    public void incrementHandlerSuccess() {
    }

    @Override
    public void incrementHandlerFailure() {
    }

    @Override
    public void incrementHandlerTimeout() {
    }

    @Override
    public void incrementHandlerExhausted() {
    }

    @Override
    public void recordInFlight(int inFlight) {
    }
  }
}
