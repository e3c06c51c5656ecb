package eventbus.dispatch;

import eventbus.Event;
import eventbus.HandlerDescriptor;

/**
 * Terminal failure: the handler will not be attempted again for this event. The cause is the
 * failure of the last attempt.
 */
public final class HandlerExhaustedException extends HandlerException {

  public HandlerExhaustedException(Event event, HandlerDescriptor handler, int attempts,
      HandlerException lastFailure) {
    super(event, handler, attempts, "Handler gave up after " + attempts + " attempt(s)",
        lastFailure);
  }

  public HandlerException lastFailure() {
    return (HandlerException) getCause();
  }
}
