package eventbus.jdbc;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Where {@link JdbcIdempotencyStore} gets its connections. The store closes every connection it
 * obtains, so pooled sources get them back after each statement.
 */
@FunctionalInterface
public interface ConnectionProvider {
  Connection getConnection() throws SQLException;

  /** Borrows connections from {@code dataSource}, usually a pool. */
  static ConnectionProvider of(DataSource dataSource) {
    Objects.requireNonNull(dataSource, "dataSource");
    return dataSource::getConnection;
  }
}
