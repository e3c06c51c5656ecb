package eventbus.dispatch;

import eventbus.Event;
import eventbus.HandlerDescriptor;

/**
 * The attempt was rejected without running the handler because its circuit is open.
 */
public final class CircuitOpenException extends HandlerException {

  public CircuitOpenException(Event event, HandlerDescriptor handler, int attemptNumber) {
    super(event, handler, attemptNumber, "Circuit open, handler not invoked", null);
  }
}
