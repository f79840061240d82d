package calendar.local;

import calendar.spi.HiddenItemStore;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link HiddenItemStore} backed by concurrent sets. Hidden state is lost on restart.
 */
public final class InMemoryHiddenItemStore implements HiddenItemStore {
  private final Set<String> calendars = ConcurrentHashMap.newKeySet();
  private final Set<String> objects = ConcurrentHashMap.newKeySet();

  @Override
  public void hideCalendar(String calendarId) {
    calendars.add(Objects.requireNonNull(calendarId, "calendarId"));
  }

  @Override
  public void hideObject(String objectId) {
    objects.add(Objects.requireNonNull(objectId, "objectId"));
  }

  @Override
  public boolean isCalendarHidden(String calendarId) {
    return calendars.contains(calendarId);
  }

  @Override
  public boolean isObjectHidden(String objectId) {
    return objects.contains(objectId);
  }
}
