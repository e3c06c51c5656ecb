package eventbus.jdbc.store;

import eventbus.jdbc.TableNames;

/**
 * H2, for tests and embedded deployments. Relies on the base class's plain insert: a duplicate
 * fails with SQLState 23505 and is reported as "already recorded". {@code MERGE} is not used
 * because it would overwrite {@code completed_at}.
 */
public final class H2ProcessingLog extends AbstractJdbcProcessingLog {

  public H2ProcessingLog() {
    this(TableNames.DEFAULT_TABLE);
  }

  public H2ProcessingLog(String tableName) {
    super("h2", tableName, "jdbc:h2:");
  }

  @Override
  public H2ProcessingLog withTableName(String tableName) {
    return new H2ProcessingLog(tableName);
  }
}
