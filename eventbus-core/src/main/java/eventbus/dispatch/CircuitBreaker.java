package eventbus.dispatch;

import eventbus.model.CircuitState;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-handler circuit breaker.
 *
 * <p>After {@code failureThreshold} consecutive failed attempts a handler's circuit opens and
 * attempts are rejected for {@code recoveryTimeoutMs}. The first attempt after that window is
 * let through as a trial (HALF_OPEN); its success closes the circuit, its failure opens it
 * again. Other attempts are rejected while the trial runs.
 *
 * <p>A threshold of 0 disables the breaker: every attempt is permitted.
 */
public final class CircuitBreaker {
  public static final int DEFAULT_FAILURE_THRESHOLD = 5;
  public static final long DEFAULT_RECOVERY_TIMEOUT_MS = 30_000;

  private final int failureThreshold;
  private final long recoveryTimeoutMs;
  private final Clock clock;
  private final Map<String, Circuit> circuits = new ConcurrentHashMap<>();

  public CircuitBreaker() {
    this(DEFAULT_FAILURE_THRESHOLD, DEFAULT_RECOVERY_TIMEOUT_MS);
  }

  public CircuitBreaker(int failureThreshold, long recoveryTimeoutMs) {
    this(failureThreshold, recoveryTimeoutMs, Clock.systemUTC());
  }

  public CircuitBreaker(int failureThreshold, long recoveryTimeoutMs, Clock clock) {
    if (failureThreshold < 0) {
      throw new IllegalArgumentException("failureThreshold must be >= 0, got: " + failureThreshold);
    }
    if (recoveryTimeoutMs < 0) {
      throw new IllegalArgumentException(
          "recoveryTimeoutMs must be >= 0, got: " + recoveryTimeoutMs);
    }
    this.failureThreshold = failureThreshold;
    this.recoveryTimeoutMs = recoveryTimeoutMs;
    this.clock = clock;
  }

  /** What {@link #acquire} granted. */
  public enum Permit {
    REJECTED, GRANTED, TRIAL;

    public boolean permitted() {
      return this != REJECTED;
    }
  }

  public static CircuitBreaker disabled() {
    return new CircuitBreaker(0, 0);
  }

  public boolean isEnabled() {
    return failureThreshold > 0;
  }

  /**
   * Asks permission for one attempt.
   *
   * @param handlerKey identifies the handler, e.g. {@code module:handlerId}
   * @return {@code false} if the attempt must be rejected
   */
  public boolean tryAcquire(String handlerKey) {
    return acquire(handlerKey).permitted();
  }

  /**
   * Like {@link #tryAcquire}, but tells a HALF_OPEN trial apart from a normal permit. A caller
   * holding {@link Permit#TRIAL} must report its outcome or {@linkplain #releaseTrial give it
   * back}, otherwise the circuit stays half-open with no further attempts let through.
   */
  public Permit acquire(String handlerKey) {
    if (!isEnabled()) {
      return Permit.GRANTED;
    }
    return circuit(handlerKey).acquire(clock.millis());
  }

  /** Returns an unused trial; the next attempt becomes the trial instead. */
  public void releaseTrial(String handlerKey) {
    if (isEnabled()) {
      circuit(handlerKey).releaseTrial();
    }
  }

  public void recordSuccess(String handlerKey) {
    if (isEnabled()) {
      circuit(handlerKey).recordSuccess();
    }
  }

  public void recordFailure(String handlerKey) {
    if (isEnabled()) {
      circuit(handlerKey).recordFailure(clock.millis());
    }
  }

  public CircuitState state(String handlerKey) {
    Circuit circuit = circuits.get(handlerKey);
    return circuit == null ? CircuitState.CLOSED : circuit.state(clock.millis());
  }

  private Circuit circuit(String handlerKey) {
    return circuits.computeIfAbsent(handlerKey, k -> new Circuit());
  }

  private final class Circuit {
    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private long openedAt;
    private boolean trialInFlight;

    synchronized Permit acquire(long now) {
      switch (state) {
        case CLOSED:
          return Permit.GRANTED;
        case OPEN:
          if (now - openedAt < recoveryTimeoutMs) {
            return Permit.REJECTED;
          }
          state = CircuitState.HALF_OPEN;
          trialInFlight = true;
          return Permit.TRIAL;
        default:
          if (trialInFlight) {
            return Permit.REJECTED;
          }
          trialInFlight = true;
          return Permit.TRIAL;
      }
    }

    synchronized void releaseTrial() {
      if (state == CircuitState.HALF_OPEN) {
        trialInFlight = false;
      }
    }

    synchronized void recordSuccess() {
      state = CircuitState.CLOSED;
      consecutiveFailures = 0;
      trialInFlight = false;
    }

    synchronized void recordFailure(long now) {
      trialInFlight = false;
      if (state == CircuitState.HALF_OPEN) {
        open(now);
        return;
      }
      consecutiveFailures++;
      if (consecutiveFailures >= failureThreshold) {
        open(now);
      }
    }

    synchronized CircuitState state(long now) {
      if (state == CircuitState.OPEN && now - openedAt >= recoveryTimeoutMs) {
        return CircuitState.HALF_OPEN;
      }
      return state;
    }

    private void open(long now) {
      state = CircuitState.OPEN;
      openedAt = now;
      consecutiveFailures = 0;
    }
  }
}
