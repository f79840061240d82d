package calendar.jdbc;

import org.h2.jdbcx.JdbcDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.UUID;

/**
 * Fresh in-memory H2 databases carrying the calendar schema.
 */
final class H2Databases {

  private H2Databases() {}

  static JdbcDataSource create() throws Exception {
    JdbcDataSource ds = new JdbcDataSource();
    ds.setURL("jdbc:h2:mem:calendar_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    runScript(ds, "/schema/h2.sql");
    return ds;
  }

  static void runScript(DataSource dataSource, String resource) throws IOException, SQLException {
    String script = loadResource(resource);
    try (Connection conn = dataSource.getConnection(); Statement statement = conn.createStatement()) {
      for (String stmt : script.split(";")) {
        String trimmed = stmt.trim();
        if (!trimmed.isEmpty()) {
          statement.execute(trimmed);
        }
      }
    }
  }

  static int count(DataSource dataSource, String sql) throws SQLException {
    try (Connection conn = dataSource.getConnection(); Statement statement = conn.createStatement();
         ResultSet rs = statement.executeQuery(sql)) {
      rs.next();
      return rs.getInt(1);
    }
  }

  static String loadResource(String path) throws IOException {
    try (InputStream is = H2Databases.class.getResourceAsStream(path)) {
      if (is == null) throw new IOException("Resource not found: " + path);
      return new String(is.readAllBytes(), StandardCharsets.UTF_8);
    }
  }
}
