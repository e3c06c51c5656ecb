package eventbus.dispatch;

import eventbus.Event;
import eventbus.HandlerDescriptor;

/**
 * The handler's {@link eventbus.PayloadValidator} rejected the event; the handler was not
 * invoked and the delivery is not retried.
 */
public final class InvalidPayloadException extends HandlerException {

  public InvalidPayloadException(Event event, HandlerDescriptor handler, int attemptNumber,
      RuntimeException cause) {
    super(event, handler, attemptNumber, "Payload validation failed: " + cause.getMessage(), cause);
  }
}
