package eventbus.dispatch;

import eventbus.Event;
import eventbus.HandlerDescriptor;
import eventbus.model.DeliveryOutcome;

import java.time.Instant;
import java.util.Objects;

/**
 * One finished execution of a handler for an event.
 *
 * @param handler       the handler that ran
 * @param event         the delivered event
 * @param attemptNumber 1-based attempt number
 * @param startedAt     when the attempt started
 * @param durationMs    elapsed time until the outcome was known
 * @param outcome       how the attempt ended
 */
public record DeliveryAttempt(
    HandlerDescriptor handler,
    Event event,
    int attemptNumber,
    Instant startedAt,
    long durationMs,
    DeliveryOutcome outcome) {

  public DeliveryAttempt {
    Objects.requireNonNull(handler, "handler");
    Objects.requireNonNull(event, "event");
    Objects.requireNonNull(startedAt, "startedAt");
    Objects.requireNonNull(outcome, "outcome");
    if (attemptNumber < 1) {
      throw new IllegalArgumentException("attemptNumber must be >= 1, got: " + attemptNumber);
    }
  }
}
