package calendar.jdbc;

import java.util.Objects;

/**
 * Table naming for the JDBC components. Every table shares a configurable prefix.
 */
public final class TableNames {
  public static final String DEFAULT_PREFIX = "calendar_";

  public static final String CALENDARS = "calendars";
  public static final String OBJECTS = "objects";
  public static final String HIDDEN_ITEMS = "hidden_items";
  public static final String UID_INDEX = "uid_index";

  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }

  /**
   * Validates a table prefix. The empty prefix is allowed.
   */
  public static String validatePrefix(String prefix) {
    Objects.requireNonNull(prefix, "prefix");
    if (!prefix.isEmpty() && !prefix.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table prefix: " + prefix);
    }
    return prefix;
  }

  /**
   * Returns the validated name {@code prefix + table}.
   */
  public static String table(String prefix, String table) {
    return validate(validatePrefix(prefix) + table);
  }
}
