package eventbus.jdbc;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.Statement;

/** Runs the bundled {@code schema/*.sql} scripts. */
final class Schemas {

  private Schemas() {}

  static void create(DataSource dataSource, String dialect) throws Exception {
    String schema = load("/schema/" + dialect + ".sql");
    try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
      for (String sql : schema.split(";")) {
        String trimmed = sql.trim();
        if (!trimmed.isEmpty()) {
          stmt.execute(trimmed);
        }
      }
    }
  }

  private static String load(String path) throws IOException {
    try (InputStream is = Schemas.class.getResourceAsStream(path)) {
      if (is == null) {
        throw new IOException("Resource not found: " + path);
      }
      return new String(is.readAllBytes(), StandardCharsets.UTF_8);
    }
  }
}
