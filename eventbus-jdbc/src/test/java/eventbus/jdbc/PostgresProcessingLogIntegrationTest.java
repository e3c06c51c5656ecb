package eventbus.jdbc;

import eventbus.jdbc.store.AbstractJdbcProcessingLog;
import eventbus.jdbc.store.PostgresProcessingLog;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;
import java.sql.Connection;

@DockerAvailable
@Testcontainers
class PostgresProcessingLogIntegrationTest extends AbstractProcessingLogIntegrationTest {

  @Container
  static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
      .withDatabaseName("eventbus_test");

  private static final PostgresProcessingLog PROCESSING_LOG = new PostgresProcessingLog();
  private static SimpleDataSource dataSource;

  @BeforeAll
  static void initSchema() throws Exception {
    dataSource = new SimpleDataSource(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
    Schemas.create(dataSource, "postgresql");
  }

  @BeforeEach
  void truncate() throws Exception {
    try (Connection conn = dataSource.getConnection()) {
      conn.createStatement().execute("TRUNCATE TABLE event_processing_log");
    }
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Override
  AbstractJdbcProcessingLog processingLog() {
    return PROCESSING_LOG;
  }
}
