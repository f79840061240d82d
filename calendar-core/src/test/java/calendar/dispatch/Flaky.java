package calendar.dispatch;

import calendar.Calendar;
import calendar.CalendarObject;
import calendar.local.Local;

import java.util.List;

/**
 * Backend whose object and calendar listings always fail.
 */
class Flaky extends Local {

  @Override
  public List<Calendar> getCalendars(String userId) {
    throw new IllegalStateException("connection reset");
  }

  @Override
  public List<CalendarObject> getObjects(String uri) {
    throw new IllegalStateException("connection reset");
  }
}
