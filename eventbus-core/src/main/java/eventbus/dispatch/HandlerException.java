package eventbus.dispatch;

import eventbus.Event;
import eventbus.HandlerDescriptor;

/**
 * A handler attempt that did not complete successfully.
 *
 * <p>Carries the delivery context (event, module, handler, attempt) so a log line or an
 * interceptor can identify the failing delivery without extra lookups. Handler failures are
 * never thrown to the publisher; they reach the log, the metrics and the interceptors.
 */
public class HandlerException extends Exception {
  private final String eventName;
  private final String eventId;
  private final String module;
  private final String handlerId;
  private final int attemptNumber;

  public HandlerException(Event event, HandlerDescriptor handler, int attemptNumber,
      String message, Throwable cause) {
    super(message + " [event=" + event.name() + ", eventId=" + event.eventId()
        + ", module=" + handler.module() + ", handler=" + handler.handlerId()
        + ", attempt=" + attemptNumber + "]", cause);
    this.eventName = event.name();
    this.eventId = event.eventId();
    this.module = handler.module();
    this.handlerId = handler.handlerId();
    this.attemptNumber = attemptNumber;
  }

  public String eventName() {
    return eventName;
  }

  public String eventId() {
    return eventId;
  }

  public String module() {
    return module;
  }

  public String handlerId() {
    return handlerId;
  }

  /**
   * @return the 1-based attempt the failure belongs to, or 0 if it happened before any attempt
   */
  public int attemptNumber() {
    return attemptNumber;
  }
}
