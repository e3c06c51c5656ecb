package eventbus.model;

/**
 * Result of a single handler attempt.
 */
public enum DeliveryOutcome {
  SUCCESS,
  FAILURE,
  TIMEOUT;

  public boolean isRetryable() {
    return this != SUCCESS;
  }
}
