package calendar.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Lightweight JDBC helper shared by the backend and the stores.
 *
 * <p>{@link SQLException}s are wrapped in {@link CalendarStoreException}. Runtime exceptions
 * thrown by callbacks propagate unchanged.
 */
public final class JdbcTemplate {
  /** Largest number of values bound into one {@code IN (...)} list. */
  static final int MAX_IN_PARAMS = 500;

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  @FunctionalInterface
  public interface ConnectionCallback<T> {
    T doInConnection(Connection conn) throws SQLException;
  }

  /** Execute INSERT/UPDATE/DELETE, return rows affected. */
  public static int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw new CalendarStoreException("Failed to execute update", e);
    }
  }

  /**
   * Execute an INSERT that may race with another writer of the same key. Returns
   * {@code false} instead of failing when the row already exists.
   */
  public static boolean insertIfAbsent(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return ps.executeUpdate() > 0;
    } catch (SQLException e) {
      if (isDuplicateKey(e)) {
        return false;
      }
      throw new CalendarStoreException("Failed to execute insert", e);
    }
  }

  /** Execute SELECT, map rows. */
  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    } catch (SQLException e) {
      throw new CalendarStoreException("Failed to execute query", e);
    }
  }

  /** Execute SELECT, map the first row if any. */
  public static <T> Optional<T> queryFirst(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    List<T> rows = query(conn, sql, mapper, params);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  /** Runs the callback on a fresh auto-commit connection. */
  public static <T> T execute(ConnectionProvider provider, ConnectionCallback<T> callback) {
    try (Connection conn = provider.getConnection()) {
      return callback.doInConnection(conn);
    } catch (SQLException e) {
      throw new CalendarStoreException("Failed to obtain or use connection", e);
    }
  }

  /**
   * Runs the callback in a single transaction. Commits when it returns, rolls back when it
   * throws.
   */
  public static <T> T inTransaction(ConnectionProvider provider, ConnectionCallback<T> callback) {
    try (Connection conn = provider.getConnection()) {
      boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      try {
        T result = callback.doInConnection(conn);
        conn.commit();
        return result;
      } catch (SQLException | RuntimeException e) {
        rollback(conn, e);
        throw e;
      } finally {
        conn.setAutoCommit(autoCommit);
      }
    } catch (SQLException e) {
      throw new CalendarStoreException("Transaction failed", e);
    }
  }

  /** Returns {@code "?,?,?"} for {@code count} bind parameters. */
  static String placeholders(int count) {
    return String.join(",", Collections.nCopies(count, "?"));
  }

  // 23505 is the standard unique violation; MySQL reports 23000 with vendor code 1062
  static boolean isDuplicateKey(SQLException e) {
    String state = e.getSQLState();
    return "23505".equals(state) || ("23000".equals(state) && e.getErrorCode() == 1062);
  }

  static Timestamp timestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  static Instant instant(ResultSet rs, String column) throws SQLException {
    Timestamp ts = rs.getTimestamp(column);
    return ts == null ? null : ts.toInstant();
  }

  private static void rollback(Connection conn, Exception cause) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Boolean b) {
        ps.setBoolean(i + 1, b);
      } else if (param instanceof Timestamp ts) {
        ps.setTimestamp(i + 1, ts);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  private JdbcTemplate() {}
}
