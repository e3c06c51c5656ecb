package eventbus;

/**
 * Checks an event's payload before a handler sees it.
 *
 * <p>Runs inside every attempt, ahead of the circuit breaker and the interceptors. Rejecting a
 * payload means throwing: the delivery fails with
 * {@link eventbus.dispatch.InvalidPayloadException} and is not retried, since the same payload
 * would fail again.
 *
 * @see HandlerDescriptor.Builder#validator(PayloadValidator)
 */
@FunctionalInterface
public interface PayloadValidator {

  /**
   * @param event the event about to be handled
   * @throws RuntimeException if the payload is not acceptable; its message ends up in the log
   */
  void validate(Event event);

  /**
   * Accepts events whose data is an instance of {@code type}; {@code null} data is rejected.
   */
  static PayloadValidator instanceOf(Class<?> type) {
    return event -> {
      if (!type.isInstance(event.data())) {
        throw new IllegalArgumentException("Expected " + type.getName() + " payload but got "
            + (event.data() == null ? "null" : event.data().getClass().getName()));
      }
    };
  }
}
