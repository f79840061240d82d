package calendar.jdbc;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JdbcTemplateTest {
  private JdbcDataSource dataSource;
  private ConnectionProvider provider;

  @BeforeEach
  void setUp() throws Exception {
    dataSource = H2Databases.create();
    provider = new DataSourceConnectionProvider(dataSource);
  }

  @Test
  void transactionCommitsWhenCallbackReturns() throws SQLException {
    JdbcTemplate.inTransaction(provider, conn -> JdbcTemplate.update(conn,
        "INSERT INTO calendar_uid_index (uid, object_id) VALUES (?,?)", "abc", "local.home.abc"));

    assertEquals(1, H2Databases.count(dataSource, "SELECT COUNT(*) FROM calendar_uid_index"));
  }

  @Test
  void transactionRollsBackWhenCallbackThrows() throws SQLException {
    IllegalStateException thrown = assertThrows(IllegalStateException.class, () ->
        JdbcTemplate.inTransaction(provider, conn -> {
          JdbcTemplate.update(conn,
              "INSERT INTO calendar_uid_index (uid, object_id) VALUES (?,?)", "abc", "local.home.abc");
          throw new IllegalStateException("boom");
        }));

    assertEquals("boom", thrown.getMessage());
    assertEquals(0, H2Databases.count(dataSource, "SELECT COUNT(*) FROM calendar_uid_index"));
  }

  @Test
  void sqlErrorsAreWrapped() {
    CalendarStoreException thrown = assertThrows(CalendarStoreException.class, () ->
        JdbcTemplate.execute(provider, conn -> JdbcTemplate.query(conn,
            "SELECT nope FROM missing_table", rs -> rs.getString(1))));

    assertInstanceOf(SQLException.class, thrown.getCause());
  }

  @Test
  void queryFirstReturnsEmptyWithoutRows() {
    Optional<String> first = JdbcTemplate.execute(provider, conn -> JdbcTemplate.queryFirst(conn,
        "SELECT object_id FROM calendar_uid_index WHERE uid = ?", rs -> rs.getString(1), "missing"));

    assertTrue(first.isEmpty());
  }

  @Test
  void nullParametersBind() {
    JdbcTemplate.execute(provider, conn -> JdbcTemplate.update(conn,
        "INSERT INTO calendar_objects (calendar_uri, uid, kind, start_at, end_at, properties, created_at)" +
            " VALUES (?,?,?,?,?,?,CURRENT_TIMESTAMP)", "home", "abc", "EVENT", null, null, "{}"));

    List<Boolean> noStart = JdbcTemplate.execute(provider, conn -> JdbcTemplate.query(conn,
        "SELECT start_at IS NULL FROM calendar_objects WHERE uid = ?", rs -> rs.getBoolean(1), "abc"));
    assertEquals(List.of(true), noStart);
  }

  @Test
  void insertIfAbsentReportsExistingKey() throws SQLException {
    String sql = "INSERT INTO calendar_uid_index (uid, object_id) VALUES (?,?)";

    assertTrue(JdbcTemplate.<Boolean>execute(provider, conn -> JdbcTemplate.insertIfAbsent(conn, sql, "abc", "local.home.abc")));
    assertFalse(JdbcTemplate.<Boolean>execute(provider, conn -> JdbcTemplate.insertIfAbsent(conn, sql, "abc", "local.work.abc")));
    assertEquals(1, H2Databases.count(dataSource, "SELECT COUNT(*) FROM calendar_uid_index"));
  }

  @Test
  void insertIfAbsentStillWrapsOtherErrors() {
    assertThrows(CalendarStoreException.class, () -> JdbcTemplate.execute(provider, conn ->
        JdbcTemplate.insertIfAbsent(conn,
            "INSERT INTO calendar_uid_index (uid, object_id) VALUES (?,?)", "abc", null)));
  }

  @Test
  void duplicateKeyDetectionCoversSupportedDatabases() {
    assertTrue(JdbcTemplate.isDuplicateKey(new SQLException("h2/postgres", "23505")));
    assertTrue(JdbcTemplate.isDuplicateKey(new SQLException("mysql", "23000", 1062)));
    assertFalse(JdbcTemplate.isDuplicateKey(new SQLException("mysql not null", "23000", 1048)));
    assertFalse(JdbcTemplate.isDuplicateKey(new SQLException("no state")));
  }
}
