package calendar.jdbc;

/**
 * Thrown when a JDBC statement against the calendar tables fails. Wraps the
 * underlying {@link java.sql.SQLException}.
 */
public final class CalendarStoreException extends RuntimeException {

  public CalendarStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
