/**
 * Durable idempotency store for the event bus on top of plain JDBC.
 *
 * @see eventbus.jdbc.JdbcIdempotencyStore
 * @see eventbus.jdbc.store.JdbcProcessingLogs
 */
package eventbus.jdbc;
