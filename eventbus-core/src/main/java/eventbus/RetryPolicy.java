package eventbus;

/**
 * Per-handler retry configuration.
 *
 * <p>A handler gets at most {@code maxAttempts} attempts per event. Between attempts the bus
 * waits {@code backoffMs}, doubled for every further attempt when {@code exponentialBackoff}
 * is set ({@code backoffMs * 2^(attempt-1)}). With {@code jitter} the delay varies by up to
 * 10% either way.
 *
 * <p>Constructing a policy never fails; an invalid policy is rejected with
 * {@link InvalidPolicyException} when the handler is registered.
 *
 * @param maxAttempts        total attempts including the first, must be &ge; 1
 * @param backoffMs          base delay between attempts in milliseconds, must be &ge; 0
 * @param exponentialBackoff whether the delay doubles per attempt
 * @param jitter             whether a random &plusmn;10% variation is applied
 * @see eventbus.dispatch.RetryScheduler
 */
public record RetryPolicy(int maxAttempts, long backoffMs, boolean exponentialBackoff, boolean jitter) {

  /** Three attempts, one second base delay, exponential backoff, no jitter. */
  public static final RetryPolicy DEFAULT = new RetryPolicy(3, 1000, true, false);

  public RetryPolicy(int maxAttempts, long backoffMs, boolean exponentialBackoff) {
    this(maxAttempts, backoffMs, exponentialBackoff, false);
  }

  /**
   * Returns a policy allowing a single attempt.
   *
   * @return a no-retry policy
   */
  public static RetryPolicy none() {
    return new RetryPolicy(1, 0, false, false);
  }

  public RetryPolicy withJitter(boolean jitter) {
    return new RetryPolicy(maxAttempts, backoffMs, exponentialBackoff, jitter);
  }
}
