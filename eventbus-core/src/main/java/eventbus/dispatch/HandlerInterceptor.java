package eventbus.dispatch;

import eventbus.Event;
import eventbus.HandlerDescriptor;

/**
 * Cross-cutting hook around every handler attempt.
 *
 * <p>Interceptors run around each attempt, retries included:
 * <ol>
 *   <li>{@link #beforeAttempt} in registration order</li>
 *   <li>Handler execution</li>
 *   <li>{@link #afterAttempt} in reverse registration order, for every interceptor whose
 *       {@code beforeAttempt} returned normally</li>
 * </ol>
 *
 * <p>If {@code beforeAttempt} throws, the attempt counts as failed and the retry policy
 * applies. {@code afterAttempt} exceptions are logged and otherwise ignored.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * EventBus.builder()
 *     .interceptor(HandlerInterceptor.before((event, handler, attempt) ->
 *         MDC.put("correlationId", event.correlationId())))
 *     .interceptor(HandlerInterceptor.after((attempt, error) -> MDC.clear()))
 *     .build();
 * }</pre>
 */
public interface HandlerInterceptor {

  /**
   * Called before the handler runs.
   *
   * @param event         the event being delivered
   * @param handler       the target handler
   * @param attemptNumber 1-based attempt number
   * @throws Exception to fail the attempt without running the handler
   */
  default void beforeAttempt(Event event, HandlerDescriptor handler, int attemptNumber)
      throws Exception {
  }

  /**
   * Called once the attempt's outcome is known.
   *
   * @param attempt the finished attempt
   * @param error   null on success, the failure otherwise
   */
  default void afterAttempt(DeliveryAttempt attempt, HandlerException error) {
  }

  static HandlerInterceptor before(BeforeHook hook) {
    return new HandlerInterceptor() {
      @Override
      public void beforeAttempt(Event event, HandlerDescriptor handler, int attemptNumber)
          throws Exception {
        hook.accept(event, handler, attemptNumber);
      }
    };
  }

  static HandlerInterceptor after(AfterHook hook) {
    return new HandlerInterceptor() {
      @Override
      public void afterAttempt(DeliveryAttempt attempt, HandlerException error) {
        hook.accept(attempt, error);
      }
    };
  }

  @FunctionalInterface
  interface BeforeHook {
    void accept(Event event, HandlerDescriptor handler, int attemptNumber) throws Exception;
  }

  @FunctionalInterface
  interface AfterHook {
    void accept(DeliveryAttempt attempt, HandlerException error);
  }
}
