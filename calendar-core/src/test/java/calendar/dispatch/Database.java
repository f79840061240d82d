package calendar.dispatch;

import calendar.Calendar;
import calendar.CalendarObject;
import calendar.local.Local;
import calendar.spi.BackendAction;

import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory backend activated under the canonical name {@code database}, with a
 * configurable capability set and per-calendar write protection.
 */
class Database extends Local {
  private final Set<String> readOnly = ConcurrentHashMap.newKeySet();

  Database() {
    super(EnumSet.allOf(BackendAction.class));
  }

  Database(Set<BackendAction> supportedActions) {
    super(supportedActions);
  }

  static Database without(BackendAction first, BackendAction... rest) {
    EnumSet<BackendAction> actions = EnumSet.allOf(BackendAction.class);
    actions.removeAll(EnumSet.of(first, rest));
    return new Database(actions);
  }

  @Override
  public Database load(Calendar calendar, CalendarObject... objects) {
    super.load(calendar, objects);
    return this;
  }

  Database readOnly(String uri) {
    readOnly.add(uri);
    return this;
  }

  @Override
  public boolean isCalendarWritableByUser(String uri, String userId) {
    return !readOnly.contains(uri) && super.isCalendarWritableByUser(uri, userId);
  }
}
