package calendar.jdbc;

import calendar.spi.HiddenItemStore;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * {@link HiddenItemStore} persisted in {@code <prefix>hidden_items}, so that emulated deletes
 * survive a restart.
 */
public final class JdbcHiddenItemStore implements HiddenItemStore {
  private static final String CALENDAR = "CALENDAR";
  private static final String OBJECT = "OBJECT";

  private final ConnectionProvider connectionProvider;
  private final String tableName;

  public JdbcHiddenItemStore(DataSource dataSource) {
    this(new DataSourceConnectionProvider(dataSource), TableNames.DEFAULT_PREFIX);
  }

  public JdbcHiddenItemStore(ConnectionProvider connectionProvider, String tablePrefix) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.tableName = TableNames.table(tablePrefix, TableNames.HIDDEN_ITEMS);
  }

  @Override
  public void hideCalendar(String calendarId) {
    hide(CALENDAR, Objects.requireNonNull(calendarId, "calendarId"));
  }

  @Override
  public void hideObject(String objectId) {
    hide(OBJECT, Objects.requireNonNull(objectId, "objectId"));
  }

  @Override
  public boolean isCalendarHidden(String calendarId) {
    return isHidden(CALENDAR, calendarId);
  }

  @Override
  public boolean isObjectHidden(String objectId) {
    return isHidden(OBJECT, objectId);
  }

  /**
   * Answers with one query per chunk of identifiers.
   */
  @Override
  public Set<String> hiddenObjects(Collection<String> objectIds) {
    if (objectIds.isEmpty()) {
      return Set.of();
    }
    List<String> ids = new ArrayList<>(objectIds);
    return JdbcTemplate.execute(connectionProvider, conn -> {
      Set<String> hidden = new LinkedHashSet<>();
      for (int from = 0; from < ids.size(); from += JdbcTemplate.MAX_IN_PARAMS) {
        List<String> chunk = ids.subList(from, Math.min(from + JdbcTemplate.MAX_IN_PARAMS, ids.size()));
        List<Object> params = new ArrayList<>(chunk.size() + 1);
        params.add(OBJECT);
        params.addAll(chunk);
        hidden.addAll(JdbcTemplate.query(conn,
            "SELECT item_id FROM " + tableName + " WHERE item_type = ? AND item_id IN ("
                + JdbcTemplate.placeholders(chunk.size()) + ")",
            rs -> rs.getString(1), params.toArray()));
      }
      return hidden;
    });
  }

  // a concurrent hide of the same item leaves the row in place either way
  private void hide(String itemType, String itemId) {
    JdbcTemplate.execute(connectionProvider, conn -> exists(conn, itemType, itemId)
        || JdbcTemplate.insertIfAbsent(conn,
            "INSERT INTO " + tableName + " (item_type, item_id) VALUES (?,?)", itemType, itemId));
  }

  private boolean isHidden(String itemType, String itemId) {
    if (itemId == null) {
      return false;
    }
    return JdbcTemplate.execute(connectionProvider, conn -> exists(conn, itemType, itemId));
  }

  private boolean exists(Connection conn, String itemType, String itemId) {
    return JdbcTemplate.queryFirst(conn,
        "SELECT 1 FROM " + tableName + " WHERE item_type = ? AND item_id = ?",
        rs -> rs.getInt(1), itemType, itemId).isPresent();
  }
}
