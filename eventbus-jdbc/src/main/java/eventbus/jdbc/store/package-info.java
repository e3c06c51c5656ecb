/**
 * Dialect SQL for the {@code event_processing_log} table.
 *
 * <p>{@link eventbus.jdbc.store.AbstractJdbcProcessingLog} holds the shared statements;
 * subclasses supply an insert that tolerates duplicates: PostgreSQL
 * ({@code ON CONFLICT DO NOTHING}), MySQL ({@code INSERT IGNORE}) and H2 (plain insert,
 * duplicate key treated as already recorded).
 *
 * @see eventbus.jdbc.store.JdbcProcessingLogs
 */
package eventbus.jdbc.store;
