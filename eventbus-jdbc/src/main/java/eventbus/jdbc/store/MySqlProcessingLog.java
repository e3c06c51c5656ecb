package eventbus.jdbc.store;

import eventbus.jdbc.JdbcTemplate;
import eventbus.jdbc.TableNames;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;

/**
 * MySQL, also selected for TiDB URLs. {@code INSERT IGNORE} turns a duplicate key into an
 * insert of zero rows.
 */
public final class MySqlProcessingLog extends AbstractJdbcProcessingLog {

  public MySqlProcessingLog() {
    this(TableNames.DEFAULT_TABLE);
  }

  public MySqlProcessingLog(String tableName) {
    super("mysql", tableName, "jdbc:mysql:", "jdbc:tidb:");
  }

  @Override
  public MySqlProcessingLog withTableName(String tableName) {
    return new MySqlProcessingLog(tableName);
  }

  @Override
  public boolean insertIfAbsent(Connection conn, String handlerId, String key, Instant completedAt)
      throws SQLException {
    return JdbcTemplate.update(conn,
        "INSERT IGNORE INTO " + tableName() + " (handler_id, idempotency_key, completed_at)"
            + " VALUES (?,?,?)",
        handlerId, key, completedAt) > 0;
  }
}
