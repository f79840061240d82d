package calendar.jdbc;

import calendar.Calendar;
import calendar.CalendarObject;
import calendar.ObjectKind;
import calendar.registry.BackendFactory;
import calendar.spi.BackendAction;
import calendar.spi.CalendarBackend;
import calendar.util.PropertyCodec;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Calendar backend over two JDBC tables, {@code <prefix>calendars} and {@code <prefix>objects}.
 * Activated under the canonical name {@code database}.
 *
 * <p>Properties are stored as flat JSON objects. A calendar is writable by its owner only.
 * Calendar merge and object move run in one transaction each; deleting a calendar removes
 * its objects in the same transaction.
 *
 * <p>Every action is supported natively unless the builder narrows the set, in which case
 * the excluded operations throw {@link UnsupportedOperationException}.
 *
 * <pre>{@code
 * Database database = Database.builder()
 *     .dataSource(dataSource)
 *     .tablePrefix("cal_")
 *     .build();
 * }</pre>
 */
public class Database implements CalendarBackend {
  public static final String LAST_MODIFIED = "LAST-MODIFIED";

  /**
   * Factory for descriptors of type {@code database}. The first argument is a
   * {@link DataSource} or a {@link ConnectionProvider}; an optional second argument is the
   * table prefix.
   */
  public static final BackendFactory FACTORY = Database::fromArguments;

  private static final String CALENDAR_COLUMNS = "uri, owner, display_name, active, properties";
  private static final String OBJECT_COLUMNS = "uid, kind, start_at, end_at, properties";

  private static final JdbcTemplate.RowMapper<Calendar> CALENDAR_ROW_MAPPER = rs -> Calendar.builder(rs.getString("uri"))
      .owner(rs.getString("owner"))
      .displayName(rs.getString("display_name"))
      .active(rs.getBoolean("active"))
      .properties(PropertyCodec.decode(rs.getString("properties")))
      .build();

  private static final JdbcTemplate.RowMapper<CalendarObject> OBJECT_ROW_MAPPER = rs -> CalendarObject.builder(rs.getString("uid"))
      .kind(ObjectKind.valueOf(rs.getString("kind")))
      .start(JdbcTemplate.instant(rs, "start_at"))
      .end(JdbcTemplate.instant(rs, "end_at"))
      .properties(PropertyCodec.decode(rs.getString("properties")))
      .build();

  private final ConnectionProvider connectionProvider;
  private final String calendarsTable;
  private final String objectsTable;
  private final Set<BackendAction> supportedActions;
  private final Clock clock;

  protected Database(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.calendarsTable = TableNames.table(builder.tablePrefix, TableNames.CALENDARS);
    this.objectsTable = TableNames.table(builder.tablePrefix, TableNames.OBJECTS);
    this.supportedActions = builder.supportedActions.isEmpty()
        ? Collections.unmodifiableSet(EnumSet.noneOf(BackendAction.class))
        : Collections.unmodifiableSet(EnumSet.copyOf(builder.supportedActions));
    this.clock = Objects.requireNonNull(builder.clock, "clock");
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public Set<BackendAction> supportedActions() {
    return supportedActions;
  }

  @Override
  public List<Calendar> getCalendars(String userId) {
    return JdbcTemplate.execute(connectionProvider, conn -> JdbcTemplate.query(conn,
        "SELECT " + CALENDAR_COLUMNS + " FROM " + calendarsTable + " WHERE owner = ? ORDER BY created_at, uri",
        CALENDAR_ROW_MAPPER, userId));
  }

  @Override
  public Optional<Calendar> findCalendar(String uri) {
    return JdbcTemplate.execute(connectionProvider, conn -> selectCalendar(conn, uri));
  }

  @Override
  public boolean isCalendarWritableByUser(String uri, String userId) {
    return findCalendar(uri).map(calendar -> calendar.owner().equals(userId)).orElse(false);
  }

  @Override
  public List<CalendarObject> getObjects(String uri) {
    return JdbcTemplate.execute(connectionProvider, conn -> JdbcTemplate.query(conn,
        "SELECT " + OBJECT_COLUMNS + " FROM " + objectsTable + " WHERE calendar_uri = ? ORDER BY created_at, uid",
        OBJECT_ROW_MAPPER, uri));
  }

  @Override
  public Optional<CalendarObject> findObject(String uri, String uid) {
    return JdbcTemplate.execute(connectionProvider, conn -> selectObject(conn, uri, uid));
  }

  @Override
  public List<CalendarObject> getInPeriod(String uri, Instant start, Instant end) {
    require(BackendAction.GET_IN_PERIOD);
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    // Objects without an end occupy the single instant of their start.
    return JdbcTemplate.execute(connectionProvider, conn -> JdbcTemplate.query(conn,
        "SELECT " + OBJECT_COLUMNS + " FROM " + objectsTable +
            " WHERE calendar_uri = ? AND start_at IS NOT NULL AND start_at <= ?" +
            " AND COALESCE(end_at, start_at) >= ? ORDER BY created_at, uid",
        OBJECT_ROW_MAPPER, uri, JdbcTemplate.timestamp(end), JdbcTemplate.timestamp(start)));
  }

  @Override
  public Calendar createCalendar(Calendar calendar) {
    require(BackendAction.CREATE_CALENDAR);
    return JdbcTemplate.inTransaction(connectionProvider, conn -> {
      if (selectCalendar(conn, calendar.uri()).isPresent()) {
        throw new IllegalStateException("Calendar already exists: " + calendar.uri());
      }
      JdbcTemplate.update(conn,
          "INSERT INTO " + calendarsTable + " (" + CALENDAR_COLUMNS + ", created_at) VALUES (?,?,?,?,?,?)",
          calendar.uri(), calendar.owner(), calendar.displayName(), calendar.active(),
          PropertyCodec.encode(calendar.properties()), JdbcTemplate.timestamp(clock.instant()));
      return calendar;
    });
  }

  @Override
  public Calendar editCalendar(Calendar calendar) {
    require(BackendAction.EDIT_CALENDAR);
    return JdbcTemplate.execute(connectionProvider, conn -> {
      int updated = JdbcTemplate.update(conn,
          "UPDATE " + calendarsTable + " SET owner = ?, display_name = ?, active = ?, properties = ? WHERE uri = ?",
          calendar.owner(), calendar.displayName(), calendar.active(),
          PropertyCodec.encode(calendar.properties()), calendar.uri());
      if (updated == 0) {
        throw new IllegalArgumentException("Calendar not found: " + calendar.uri());
      }
      return calendar;
    });
  }

  @Override
  public boolean deleteCalendar(String uri) {
    require(BackendAction.DELETE_CALENDAR);
    return JdbcTemplate.inTransaction(connectionProvider, conn -> {
      JdbcTemplate.update(conn, "DELETE FROM " + objectsTable + " WHERE calendar_uri = ?", uri);
      return JdbcTemplate.update(conn, "DELETE FROM " + calendarsTable + " WHERE uri = ?", uri) > 0;
    });
  }

  @Override
  public boolean touchCalendar(String uri) {
    require(BackendAction.TOUCH_CALENDAR);
    return JdbcTemplate.inTransaction(connectionProvider, conn -> {
      Optional<Calendar> calendar = selectCalendar(conn, uri);
      if (calendar.isEmpty()) {
        return false;
      }
      Map<String, String> properties = touched(calendar.get().properties());
      return JdbcTemplate.update(conn, "UPDATE " + calendarsTable + " SET properties = ? WHERE uri = ?",
          PropertyCodec.encode(properties), uri) > 0;
    });
  }

  @Override
  public int mergeCalendar(String destinationUri, String sourceUri) {
    require(BackendAction.MERGE_CALENDAR);
    return JdbcTemplate.inTransaction(connectionProvider, conn -> {
      if (selectCalendar(conn, destinationUri).isEmpty()) {
        throw new IllegalArgumentException("Calendar not found: " + destinationUri);
      }
      List<String> collisions = JdbcTemplate.query(conn,
          "SELECT s.uid FROM " + objectsTable + " s JOIN " + objectsTable + " d ON d.uid = s.uid" +
              " WHERE s.calendar_uri = ? AND d.calendar_uri = ?",
          rs -> rs.getString(1), sourceUri, destinationUri);
      if (!collisions.isEmpty()) {
        throw new IllegalStateException("Objects " + collisions + " already exist in " + destinationUri);
      }
      int moved = JdbcTemplate.update(conn,
          "UPDATE " + objectsTable + " SET calendar_uri = ? WHERE calendar_uri = ?", destinationUri, sourceUri);
      JdbcTemplate.update(conn, "DELETE FROM " + calendarsTable + " WHERE uri = ?", sourceUri);
      return moved;
    });
  }

  @Override
  public CalendarObject createObject(String uri, CalendarObject object) {
    require(BackendAction.CREATE_OBJECT);
    return JdbcTemplate.inTransaction(connectionProvider, conn -> {
      requireCalendar(conn, uri);
      if (selectObject(conn, uri, object.uid()).isPresent()) {
        throw new IllegalStateException("Object " + object.uid() + " already exists in " + uri);
      }
      insertObject(conn, uri, object);
      return object;
    });
  }

  @Override
  public CalendarObject editObject(String uri, CalendarObject object) {
    require(BackendAction.EDIT_OBJECT);
    return JdbcTemplate.inTransaction(connectionProvider, conn -> {
      requireCalendar(conn, uri);
      int updated = JdbcTemplate.update(conn,
          "UPDATE " + objectsTable + " SET kind = ?, start_at = ?, end_at = ?, properties = ?" +
              " WHERE calendar_uri = ? AND uid = ?",
          object.kind().name(), JdbcTemplate.timestamp(object.start().orElse(null)),
          JdbcTemplate.timestamp(object.end().orElse(null)), PropertyCodec.encode(object.properties()),
          uri, object.uid());
      if (updated == 0) {
        throw new IllegalArgumentException("Object " + object.uid() + " not found in " + uri);
      }
      return object;
    });
  }

  @Override
  public boolean deleteObject(String uri, String uid) {
    require(BackendAction.DELETE_OBJECT);
    return JdbcTemplate.execute(connectionProvider, conn -> JdbcTemplate.update(conn,
        "DELETE FROM " + objectsTable + " WHERE calendar_uri = ? AND uid = ?", uri, uid) > 0);
  }

  @Override
  public boolean touchObject(String uri, String uid) {
    require(BackendAction.TOUCH_OBJECT);
    return JdbcTemplate.inTransaction(connectionProvider, conn -> {
      Optional<CalendarObject> object = selectObject(conn, uri, uid);
      if (object.isEmpty()) {
        return false;
      }
      Map<String, String> properties = touched(object.get().properties());
      return JdbcTemplate.update(conn,
          "UPDATE " + objectsTable + " SET properties = ? WHERE calendar_uri = ? AND uid = ?",
          PropertyCodec.encode(properties), uri, uid) > 0;
    });
  }

  @Override
  public boolean moveObject(String uri, String uid, String destinationUri) {
    require(BackendAction.MOVE_OBJECT);
    return JdbcTemplate.inTransaction(connectionProvider, conn -> {
      if (selectObject(conn, uri, uid).isEmpty()) {
        return false;
      }
      requireCalendar(conn, destinationUri);
      if (selectObject(conn, destinationUri, uid).isPresent()) {
        throw new IllegalStateException("Object " + uid + " already exists in " + destinationUri);
      }
      return JdbcTemplate.update(conn,
          "UPDATE " + objectsTable + " SET calendar_uri = ? WHERE calendar_uri = ? AND uid = ?",
          destinationUri, uri, uid) > 0;
    });
  }

  private Optional<Calendar> selectCalendar(Connection conn, String uri) {
    return JdbcTemplate.queryFirst(conn,
        "SELECT " + CALENDAR_COLUMNS + " FROM " + calendarsTable + " WHERE uri = ?",
        CALENDAR_ROW_MAPPER, uri);
  }

  private Optional<CalendarObject> selectObject(Connection conn, String uri, String uid) {
    return JdbcTemplate.queryFirst(conn,
        "SELECT " + OBJECT_COLUMNS + " FROM " + objectsTable + " WHERE calendar_uri = ? AND uid = ?",
        OBJECT_ROW_MAPPER, uri, uid);
  }

  private void requireCalendar(Connection conn, String uri) {
    if (selectCalendar(conn, uri).isEmpty()) {
      throw new IllegalArgumentException("Calendar not found: " + uri);
    }
  }

  private void insertObject(Connection conn, String uri, CalendarObject object) {
    JdbcTemplate.update(conn,
        "INSERT INTO " + objectsTable + " (calendar_uri, " + OBJECT_COLUMNS + ", created_at) VALUES (?,?,?,?,?,?,?)",
        uri, object.uid(), object.kind().name(),
        JdbcTemplate.timestamp(object.start().orElse(null)),
        JdbcTemplate.timestamp(object.end().orElse(null)),
        PropertyCodec.encode(object.properties()),
        JdbcTemplate.timestamp(clock.instant()));
  }

  private Map<String, String> touched(Map<String, String> properties) {
    Map<String, String> copy = new LinkedHashMap<>(properties);
    copy.put(LAST_MODIFIED, clock.instant().toString());
    return copy;
  }

  private void require(BackendAction action) {
    if (!supportedActions.contains(action)) {
      throw new UnsupportedOperationException(action.name());
    }
  }

  private static Database fromArguments(List<Object> arguments) {
    if (arguments.isEmpty() || arguments.size() > 2) {
      throw new IllegalArgumentException(
          "Expected a DataSource or ConnectionProvider and an optional table prefix but got " + arguments);
    }
    Builder builder = builder();
    Object source = arguments.get(0);
    if (source instanceof DataSource dataSource) {
      builder.dataSource(dataSource);
    } else if (source instanceof ConnectionProvider provider) {
      builder.connectionProvider(provider);
    } else {
      throw new IllegalArgumentException("Expected a DataSource or ConnectionProvider but got " + source);
    }
    if (arguments.size() == 2) {
      if (!(arguments.get(1) instanceof String prefix)) {
        throw new IllegalArgumentException("Expected a table prefix but got " + arguments.get(1));
      }
      builder.tablePrefix(prefix);
    }
    return builder.build();
  }

  /**
   * Builder for {@link Database}.
   */
  public static class Builder {
    private ConnectionProvider connectionProvider;
    private String tablePrefix = TableNames.DEFAULT_PREFIX;
    private Set<BackendAction> supportedActions = EnumSet.allOf(BackendAction.class);
    private Clock clock = Clock.systemUTC();

    protected Builder() {
    }

    /**
     * Sets the connection source.
     *
     * <p><b>Required</b> unless {@link #dataSource(DataSource)} is called.
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Shorthand for {@code connectionProvider(new DataSourceConnectionProvider(dataSource))}.
     */
    public Builder dataSource(DataSource dataSource) {
      this.connectionProvider = new DataSourceConnectionProvider(dataSource);
      return this;
    }

    /**
     * Sets the prefix of the {@code calendars} and {@code objects} tables.
     *
     * <p>Optional. Defaults to {@value TableNames#DEFAULT_PREFIX}.
     *
     * @param tablePrefix the table prefix, possibly empty
     * @return this builder
     */
    public Builder tablePrefix(String tablePrefix) {
      this.tablePrefix = tablePrefix;
      return this;
    }

    /**
     * Narrows the natively supported actions.
     *
     * <p>Optional. Defaults to every {@link BackendAction}.
     *
     * @param supportedActions the supported actions
     * @return this builder
     */
    public Builder supportedActions(Set<BackendAction> supportedActions) {
      this.supportedActions = Objects.requireNonNull(supportedActions, "supportedActions");
      return this;
    }

    /**
     * Optional. Defaults to the UTC system clock. Used for creation order and touch stamps.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Database build() {
      return new Database(this);
    }
  }
}
