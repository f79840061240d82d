package calendar.spi;

import calendar.Calendar;

import java.util.Optional;

/**
 * Staleness gate consulted before a backend lookup of a calendar.
 *
 * <p>A cached calendar is returned to the caller only when it is present and not stale.
 * This layer never writes to the cache; populating and invalidating it is the
 * implementation's concern. {@link #NONE} never has anything cached.
 */
public interface CalendarCache {

  CalendarCache NONE = new CalendarCache() {
    @Override
    public Optional<Calendar> lookup(String calendarId) {
      return Optional.empty();
    }

    @Override
    public boolean isStale(String calendarId) {
      return true;
    }
  };

  /**
   * @param calendarId composite calendar identifier
   * @return the cached calendar, or empty
   */
  Optional<Calendar> lookup(String calendarId);

  /**
   * @param calendarId composite calendar identifier
   * @return {@code true} if the cached entry must not be trusted
   */
  boolean isStale(String calendarId);
}
