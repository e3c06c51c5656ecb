package eventbus.jdbc;

import eventbus.jdbc.store.AbstractJdbcProcessingLog;
import eventbus.jdbc.store.JdbcProcessingLogs;
import eventbus.model.IdempotencyRecord;
import eventbus.spi.IdempotencyStore;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link IdempotencyStore} persisting completion records in a relational table, so
 * de-duplication survives a restart and is shared by every node using the same database.
 *
 * <p>Each call borrows a connection from the {@link ConnectionProvider}, runs one statement in
 * auto-commit mode and closes it. JDBC failures surface as {@link IdempotencyStoreException}.
 *
 * <pre>{@code
 * IdempotencyStore store = JdbcIdempotencyStore.forDataSource(dataSource);
 * EventBus bus = EventBus.builder().idempotencyStore(store).build();
 * }</pre>
 *
 * <p>The table must exist; see {@code schema/h2.sql}, {@code schema/postgresql.sql} and
 * {@code schema/mysql.sql} on this module's classpath.
 */
public final class JdbcIdempotencyStore implements IdempotencyStore {
  private final ConnectionProvider connectionProvider;
  private final AbstractJdbcProcessingLog processingLog;
  private final Clock clock;

  public JdbcIdempotencyStore(ConnectionProvider connectionProvider,
      AbstractJdbcProcessingLog processingLog) {
    this(connectionProvider, processingLog, Clock.systemUTC());
  }

  public JdbcIdempotencyStore(ConnectionProvider connectionProvider,
      AbstractJdbcProcessingLog processingLog, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.processingLog = Objects.requireNonNull(processingLog, "processingLog");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Creates a store on the default table, detecting the dialect from the DataSource URL.
   *
   * @throws IllegalStateException if no dialect matches the database
   */
  public static JdbcIdempotencyStore forDataSource(DataSource dataSource) {
    return forDataSource(dataSource, TableNames.DEFAULT_TABLE);
  }

  /**
   * Creates a store on {@code tableName}, detecting the dialect from the DataSource URL.
   *
   * @throws IllegalStateException    if no dialect matches the database
   * @throws IllegalArgumentException if the table name is not a plain SQL identifier
   */
  public static JdbcIdempotencyStore forDataSource(DataSource dataSource, String tableName) {
    AbstractJdbcProcessingLog log = JdbcProcessingLogs.detect(dataSource).withTableName(tableName);
    return new JdbcIdempotencyStore(ConnectionProvider.of(dataSource), log);
  }

  @Override
  public boolean hasCompleted(String handlerId, String key) {
    if (key == null) {
      return false;
    }
    return withConnection("check completion", handlerId, key,
        conn -> processingLog.exists(conn, handlerId, key));
  }

  @Override
  public boolean markCompleted(String handlerId, String key) {
    if (key == null) {
      return false;
    }
    Objects.requireNonNull(handlerId, "handlerId");
    Instant now = clock.instant();
    return withConnection("record completion", handlerId, key,
        conn -> processingLog.insertIfAbsent(conn, handlerId, key, now));
  }

  public Optional<IdempotencyRecord> find(String handlerId, String key) {
    if (handlerId == null || key == null) {
      return Optional.empty();
    }
    return withConnection("find completion", handlerId, key,
        conn -> processingLog.find(conn, handlerId, key));
  }

  /**
   * Removes a completion record so the next delivery for that key runs the handler again.
   *
   * @return {@code true} if a record was removed
   */
  public boolean forget(String handlerId, String key) {
    return withConnection("forget completion", handlerId, key,
        conn -> processingLog.delete(conn, handlerId, key) > 0);
  }

  /**
   * Deletes records completed before {@code cutoff}.
   *
   * @return rows deleted
   */
  public int purgeCompletedBefore(Instant cutoff) {
    Objects.requireNonNull(cutoff, "cutoff");
    return withConnection("purge completions", null, null,
        conn -> processingLog.deleteCompletedBefore(conn, cutoff));
  }

  public AbstractJdbcProcessingLog processingLog() {
    return processingLog;
  }

  private <T> T withConnection(String action, String handlerId, String key, SqlAction<T> op) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return op.execute(conn);
    } catch (SQLException e) {
      throw new IdempotencyStoreException(action, handlerId, key, e);
    }
  }

  @FunctionalInterface
  private interface SqlAction<T> {
    T execute(Connection conn) throws SQLException;
  }
}
