package eventbus.jdbc.store;

import eventbus.jdbc.JdbcTemplate;
import eventbus.jdbc.TableNames;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;

/**
 * PostgreSQL. A failed insert would abort an enclosing transaction, so duplicates are absorbed
 * with {@code ON CONFLICT DO NOTHING} instead of being caught.
 */
public final class PostgresProcessingLog extends AbstractJdbcProcessingLog {

  public PostgresProcessingLog() {
    this(TableNames.DEFAULT_TABLE);
  }

  public PostgresProcessingLog(String tableName) {
    super("postgresql", tableName, "jdbc:postgresql:");
  }

  @Override
  public PostgresProcessingLog withTableName(String tableName) {
    return new PostgresProcessingLog(tableName);
  }

  @Override
  public boolean insertIfAbsent(Connection conn, String handlerId, String key, Instant completedAt)
      throws SQLException {
    int inserted = JdbcTemplate.update(conn,
        "INSERT INTO " + tableName() + " (handler_id, idempotency_key, completed_at)"
            + " VALUES (?,?,?) ON CONFLICT (handler_id, idempotency_key) DO NOTHING",
        handlerId, key, completedAt);
    return inserted == 1;
  }
}
