package eventbus.jdbc.store;

import eventbus.jdbc.JdbcTemplate;
import eventbus.jdbc.TableNames;
import eventbus.model.IdempotencyRecord;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * SQL for the {@code event_processing_log} table, one row per completed
 * {@code (handler_id, idempotency_key)} pair.
 *
 * <p>The base class issues a plain {@code INSERT} and treats a primary-key violation as
 * "already recorded". Subclasses override {@link #insertIfAbsent} with a dialect statement that
 * never fails on duplicates. Register custom implementations via
 * {@code META-INF/services/eventbus.jdbc.store.AbstractJdbcProcessingLog}.
 *
 * <p>Instances are stateless apart from the table name and may be shared.
 *
 * @see JdbcProcessingLogs
 */
public abstract class AbstractJdbcProcessingLog {
  protected static final JdbcTemplate.RowMapper<IdempotencyRecord> RECORD_ROW_MAPPER =
      rs -> new IdempotencyRecord(
          rs.getString("handler_id"),
          rs.getString("idempotency_key"),
          rs.getTimestamp("completed_at").toInstant());

  private final String name;
  private final List<String> jdbcUrlPrefixes;
  private final String tableName;

  /**
   * @param name            dialect name used for explicit selection, e.g. {@code "mysql"}
   * @param tableName       processing log table
   * @param jdbcUrlPrefixes URL prefixes this dialect is detected from, e.g. {@code "jdbc:tidb:"}
   */
  protected AbstractJdbcProcessingLog(String name, String tableName, String... jdbcUrlPrefixes) {
    this.name = name;
    this.tableName = TableNames.validate(tableName);
    this.jdbcUrlPrefixes = List.of(jdbcUrlPrefixes);
  }

  public final String name() {
    return name;
  }

  public final List<String> jdbcUrlPrefixes() {
    return jdbcUrlPrefixes;
  }

  /**
   * Same dialect, another table.
   *
   * @throws IllegalArgumentException if the name is not a plain SQL identifier
   */
  public abstract AbstractJdbcProcessingLog withTableName(String tableName);

  public String tableName() {
    return tableName;
  }

  public boolean exists(Connection conn, String handlerId, String key) throws SQLException {
    String sql = "SELECT 1 FROM " + tableName() + " WHERE handler_id=? AND idempotency_key=?";
    return JdbcTemplate.exists(conn, sql, handlerId, key);
  }

  /**
   * Inserts a completion record unless one exists.
   *
   * @return {@code true} if this call inserted the row
   */
  public boolean insertIfAbsent(Connection conn, String handlerId, String key, Instant completedAt)
      throws SQLException {
    String sql = "INSERT INTO " + tableName()
        + " (handler_id, idempotency_key, completed_at) VALUES (?,?,?)";
    try {
      return JdbcTemplate.update(conn, sql, handlerId, key, completedAt) > 0;
    } catch (SQLException e) {
      if (JdbcTemplate.isDuplicateKey(e)) {
        return false;
      }
      throw e;
    }
  }

  public Optional<IdempotencyRecord> find(Connection conn, String handlerId, String key)
      throws SQLException {
    String sql = "SELECT handler_id, idempotency_key, completed_at FROM " + tableName()
        + " WHERE handler_id=? AND idempotency_key=?";
    return JdbcTemplate.queryFirst(conn, sql, RECORD_ROW_MAPPER, handlerId, key);
  }

  /**
   * Deletes a completion record so the handler runs again for that key.
   *
   * @return rows deleted
   */
  public int delete(Connection conn, String handlerId, String key) throws SQLException {
    String sql = "DELETE FROM " + tableName() + " WHERE handler_id=? AND idempotency_key=?";
    return JdbcTemplate.update(conn, sql, handlerId, key);
  }

  /**
   * Deletes records completed before {@code cutoff}.
   *
   * @return rows deleted
   */
  public int deleteCompletedBefore(Connection conn, Instant cutoff) throws SQLException {
    String sql = "DELETE FROM " + tableName() + " WHERE completed_at < ?";
    return JdbcTemplate.update(conn, sql, cutoff);
  }
}
