package eventbus.jdbc;

import eventbus.jdbc.store.AbstractJdbcProcessingLog;
import eventbus.jdbc.store.MySqlProcessingLog;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import javax.sql.DataSource;
import java.sql.Connection;

@DockerAvailable
@Testcontainers
class MySqlProcessingLogIntegrationTest extends AbstractProcessingLogIntegrationTest {

  @Container
  static final MySQLContainer<?> mysql = new MySQLContainer<>("mysql:8.0")
      .withDatabaseName("eventbus_test");

  private static final MySqlProcessingLog PROCESSING_LOG = new MySqlProcessingLog();
  private static SimpleDataSource dataSource;

  @BeforeAll
  static void initSchema() throws Exception {
    dataSource = new SimpleDataSource(mysql.getJdbcUrl(), mysql.getUsername(), mysql.getPassword());
    Schemas.create(dataSource, "mysql");
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
