/**
 * Per-handler delivery: retries with backoff, per-attempt timeouts, circuit breaking,
 * in-flight de-duplication and interceptors.
 *
 * @see eventbus.dispatch.HandlerDispatcher
 * @see eventbus.dispatch.RetryScheduler
 */
package eventbus.dispatch;
