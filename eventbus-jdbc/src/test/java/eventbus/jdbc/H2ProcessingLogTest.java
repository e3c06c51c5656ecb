package eventbus.jdbc;

import eventbus.jdbc.store.AbstractJdbcProcessingLog;
import eventbus.jdbc.store.H2ProcessingLog;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;

import javax.sql.DataSource;
import java.util.UUID;

class H2ProcessingLogTest extends AbstractProcessingLogIntegrationTest {
  private final H2ProcessingLog processingLog = new H2ProcessingLog();
  private JdbcDataSource dataSource;

  @BeforeEach
  void setUp() throws Exception {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    Schemas.create(dataSource, "h2");
  }

  @Override
  DataSource dataSource() {
    return dataSource;
  }

  @Override
  AbstractJdbcProcessingLog processingLog() {
    return processingLog;
  }
}
