package eventbus.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

/**
 * Prepared-statement helpers for processing log SQL.
 *
 * <p>Failures stay {@link SQLException}s; {@link JdbcIdempotencyStore} wraps them with the
 * handler and key involved.
 */
public final class JdbcTemplate {
  private static final String INTEGRITY_CONSTRAINT_CLASS = "23";

  private JdbcTemplate() {}

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** @return rows affected */
  public static int update(Connection conn, String sql, Object... params) throws SQLException {
    try (PreparedStatement ps = prepare(conn, sql, params)) {
      return ps.executeUpdate();
    }
  }

  public static boolean exists(Connection conn, String sql, Object... params) throws SQLException {
    try (PreparedStatement ps = prepare(conn, sql, params); ResultSet rs = ps.executeQuery()) {
      return rs.next();
    }
  }

  /** Maps the first row, if any. */
  public static <T> Optional<T> queryFirst(Connection conn, String sql, RowMapper<T> mapper,
      Object... params) throws SQLException {
    try (PreparedStatement ps = prepare(conn, sql, params); ResultSet rs = ps.executeQuery()) {
      return rs.next() ? Optional.of(mapper.map(rs)) : Optional.empty();
    }
  }

  /**
   * Whether {@code e} reports an integrity constraint violation (SQLState class {@code 23}),
   * which for an insert into the processing log means the record already exists.
   */
  public static boolean isDuplicateKey(SQLException e) {
    for (SQLException next = e; next != null; next = next.getNextException()) {
      String state = next.getSQLState();
      if (state != null && state.startsWith(INTEGRITY_CONSTRAINT_CLASS)) {
        return true;
      }
    }
    return false;
  }

  private static PreparedStatement prepare(Connection conn, String sql, Object... params)
      throws SQLException {
    PreparedStatement ps = conn.prepareStatement(sql);
    try {
      for (int i = 0; i < params.length; i++) {
        Object param = params[i];
        if (param instanceof Instant instant) {
          ps.setTimestamp(i + 1, Timestamp.from(instant));
        } else {
          ps.setObject(i + 1, param);
        }
      }
      return ps;
    } catch (SQLException e) {
      ps.close();
      throw e;
    }
  }
}
