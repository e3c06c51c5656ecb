package eventbus.dispatch;

import eventbus.RetryPolicy;
import eventbus.model.DeliveryOutcome;
import eventbus.util.DaemonThreadFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Computes backoff delays and runs delayed work on a single daemon timer thread.
 *
 * <p>Delay formula: {@code backoffMs * 2^(attempt-1)} for exponential policies, otherwise
 * {@code backoffMs}. Exponential delays are capped at {@code maxDelayMs}. With jitter the
 * delay is multiplied by a random factor in [0.9, 1.1).
 *
 * <p>The timer thread only hands work off (start a retry, fire a timeout); it never runs a
 * handler, so a slow handler cannot delay another handler's retry or timeout.
 */
public final class RetryScheduler implements AutoCloseable {
  public static final long DEFAULT_MAX_DELAY_MS = 60_000;

  private final ScheduledExecutorService timer;
  private final long maxDelayMs;

  public RetryScheduler() {
    this(DEFAULT_MAX_DELAY_MS);
  }

  /**
   * @param maxDelayMs cap for exponential delays in milliseconds
   */
  public RetryScheduler(long maxDelayMs) {
    if (maxDelayMs <= 0) {
      throw new IllegalArgumentException("maxDelayMs must be > 0, got: " + maxDelayMs);
    }
    this.maxDelayMs = maxDelayMs;
    this.timer = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("eventbus-timer-"));
  }

  /**
   * Returns the delay before the attempt following {@code attemptNumber}.
   *
   * @param policy        the handler's retry policy
   * @param attemptNumber the 1-based number of the attempt that just failed
   * @return delay in milliseconds, 0 for {@code attemptNumber <= 0}
   */
  public long nextDelay(RetryPolicy policy, int attemptNumber) {
    if (attemptNumber <= 0) {
      return 0L;
    }
    long base = policy.backoffMs();
    long delay;
    if (!policy.exponentialBackoff()) {
      delay = base;
    } else if (base == 0) {
      delay = 0L;
    } else if (attemptNumber >= 63) {
      delay = maxDelayMs;
    } else {
      long shift = 1L << (attemptNumber - 1);
      // Saturate instead of overflowing
      delay = shift > maxDelayMs / base ? maxDelayMs : Math.min(maxDelayMs, base * shift);
    }
    if (policy.jitter() && delay > 0) {
      delay = (long) (delay * ThreadLocalRandom.current().nextDouble(0.9, 1.1));
    }
    return Math.max(0L, delay);
  }

  /**
   * Returns whether another attempt follows an attempt with the given outcome.
   */
  public boolean shouldRetry(RetryPolicy policy, int attemptNumber, DeliveryOutcome outcome) {
    return outcome.isRetryable() && attemptNumber < policy.maxAttempts();
  }

  /**
   * Runs {@code task} on the timer thread after {@code delayMs}.
   *
   * @throws java.util.concurrent.RejectedExecutionException if the scheduler is closed
   */
  public ScheduledFuture<?> schedule(long delayMs, Runnable task) {
    return timer.schedule(task, Math.max(0L, delayMs), TimeUnit.MILLISECONDS);
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }

  @Override
  public void close() {
    timer.shutdownNow();
  }
}
