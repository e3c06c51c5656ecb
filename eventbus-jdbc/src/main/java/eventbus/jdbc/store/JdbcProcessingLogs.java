package eventbus.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of processing log dialects with auto-detection.
 *
 * <p>Dialects are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/eventbus.jdbc.store.AbstractJdbcProcessingLog}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * AbstractJdbcProcessingLog log = JdbcProcessingLogs.detect(dataSource);
 * AbstractJdbcProcessingLog log = JdbcProcessingLogs.detect("jdbc:postgresql://db/app");
 * AbstractJdbcProcessingLog log = JdbcProcessingLogs.get("mysql");
 * }</pre>
 */
public final class JdbcProcessingLogs {

  private static final List<AbstractJdbcProcessingLog> LOGS;
  private static final Map<String, AbstractJdbcProcessingLog> BY_NAME = new ConcurrentHashMap<>();

  static {
    LOGS = ServiceLoader.load(AbstractJdbcProcessingLog.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcProcessingLog log : LOGS) {
      BY_NAME.put(log.name().toLowerCase(), log);
    }
  }

  private JdbcProcessingLogs() {
  }

  public static List<AbstractJdbcProcessingLog> all() {
    return LOGS;
  }

  /**
   * Gets a dialect by name.
   *
   * @param name dialect name (case-insensitive)
   * @return the dialect
   * @throws IllegalArgumentException if no dialect has that name
   */
  public static AbstractJdbcProcessingLog get(String name) {
    Objects.requireNonNull(name, "name");
    AbstractJdbcProcessingLog log = BY_NAME.get(name.toLowerCase());
    if (log == null) {
      throw new IllegalArgumentException("Unknown processing log dialect: " + name
          + ". Available: " + BY_NAME.keySet());
    }
    return log;
  }

  /**
   * Detects the dialect from a DataSource's connection URL.
   *
   * @throws IllegalStateException if the URL cannot be read or no dialect matches
   */
  public static AbstractJdbcProcessingLog detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      return detect(conn.getMetaData().getURL());
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect processing log dialect from DataSource", e);
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException(e.getMessage(), e);
    }
  }

  /**
   * Detects the dialect from a JDBC URL.
   *
   * @throws IllegalArgumentException if no dialect matches
   */
  public static AbstractJdbcProcessingLog detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    String url = jdbcUrl.toLowerCase();
    for (AbstractJdbcProcessingLog log : LOGS) {
      for (String prefix : log.jdbcUrlPrefixes()) {
        if (url.startsWith(prefix.toLowerCase())) {
          return log;
        }
      }
    }
    throw new IllegalArgumentException("No processing log dialect found for JDBC URL: " + jdbcUrl
        + ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return LOGS.stream()
        .flatMap(log -> log.jdbcUrlPrefixes().stream())
        .toList();
  }
}
