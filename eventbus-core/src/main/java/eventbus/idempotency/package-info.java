/**
 * Built-in idempotency store.
 *
 * @see eventbus.idempotency.InMemoryIdempotencyStore
 * @see eventbus.spi.IdempotencyStore
 */
package eventbus.idempotency;
