package eventbus.dispatch;

import eventbus.Event;
import eventbus.HandlerDescriptor;

/**
 * The attempt was still running when its timeout elapsed. The handler thread is interrupted,
 * but a handler that ignores interruption keeps running; its result is discarded.
 */
public final class HandlerTimeoutException extends HandlerException {
  private final long timeoutMs;

  public HandlerTimeoutException(Event event, HandlerDescriptor handler, int attemptNumber,
      long timeoutMs) {
    super(event, handler, attemptNumber, "Handler timed out after " + timeoutMs + "ms", null);
    this.timeoutMs = timeoutMs;
  }

  public long timeoutMs() {
    return timeoutMs;
  }
}
