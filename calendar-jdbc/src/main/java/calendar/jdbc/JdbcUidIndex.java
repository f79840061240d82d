package calendar.jdbc;

import calendar.spi.UidIndex;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link UidIndex} persisted in {@code <prefix>uid_index}.
 *
 * <p>Writes run in auto-commit mode. A put that loses an insert race against another put of
 * the same UID turns into an update, so concurrent readers populating the index never fail.
 */
public final class JdbcUidIndex implements UidIndex {
  private final ConnectionProvider connectionProvider;
  private final String tableName;

  public JdbcUidIndex(DataSource dataSource) {
    this(new DataSourceConnectionProvider(dataSource), TableNames.DEFAULT_PREFIX);
  }

  public JdbcUidIndex(ConnectionProvider connectionProvider, String tablePrefix) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.tableName = TableNames.table(tablePrefix, TableNames.UID_INDEX);
  }

  @Override
  public void put(String uid, String objectId) {
    Objects.requireNonNull(uid, "uid");
    Objects.requireNonNull(objectId, "objectId");
    JdbcTemplate.execute(connectionProvider, conn -> {
      upsert(conn, uid, objectId);
      return null;
    });
  }

  /**
   * Writes every entry over one connection, skipping entries that already hold the same
   * object id.
   */
  @Override
  public void putAll(Map<String, String> entries) {
    if (entries.isEmpty()) {
      return;
    }
    JdbcTemplate.execute(connectionProvider, conn -> {
      Map<String, String> current = current(conn, new ArrayList<>(entries.keySet()));
      for (Map.Entry<String, String> entry : entries.entrySet()) {
        String uid = Objects.requireNonNull(entry.getKey(), "uid");
        String objectId = Objects.requireNonNull(entry.getValue(), "objectId");
        if (!objectId.equals(current.get(uid))) {
          upsert(conn, uid, objectId);
        }
      }
      return null;
    });
  }

  @Override
  public Optional<String> lookup(String uid) {
    if (uid == null) {
      return Optional.empty();
    }
    return JdbcTemplate.execute(connectionProvider, conn -> JdbcTemplate.queryFirst(conn,
        "SELECT object_id FROM " + tableName + " WHERE uid = ?", rs -> rs.getString(1), uid));
  }

  @Override
  public void remove(String uid, String objectId) {
    JdbcTemplate.execute(connectionProvider, conn -> JdbcTemplate.update(conn,
        "DELETE FROM " + tableName + " WHERE uid = ? AND object_id = ?", uid, objectId));
  }

  private void upsert(Connection conn, String uid, String objectId) {
    String update = "UPDATE " + tableName + " SET object_id = ? WHERE uid = ?";
    if (JdbcTemplate.update(conn, update, objectId, uid) > 0) {
      return;
    }
    boolean inserted = JdbcTemplate.insertIfAbsent(conn,
        "INSERT INTO " + tableName + " (uid, object_id) VALUES (?,?)", uid, objectId);
    if (!inserted) {
      // another put inserted the row after our update
      JdbcTemplate.update(conn, update, objectId, uid);
    }
  }

  private Map<String, String> current(Connection conn, List<String> uids) {
    Map<String, String> current = new HashMap<>();
    for (int from = 0; from < uids.size(); from += JdbcTemplate.MAX_IN_PARAMS) {
      List<String> chunk = uids.subList(from, Math.min(from + JdbcTemplate.MAX_IN_PARAMS, uids.size()));
      List<String[]> rows = JdbcTemplate.query(conn,
          "SELECT uid, object_id FROM " + tableName
              + " WHERE uid IN (" + JdbcTemplate.placeholders(chunk.size()) + ")",
          rs -> new String[]{rs.getString(1), rs.getString(2)},
          chunk.toArray());
      for (String[] row : rows) {
        current.put(row[0], row[1]);
      }
    }
    return current;
  }
}
