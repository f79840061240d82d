package calendar.local;

import calendar.Calendar;
import calendar.CalendarObject;
import calendar.registry.BackendFactory;
import calendar.spi.BackendAction;
import calendar.spi.CalendarBackend;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory calendar backend.
 *
 * <p>Calendars and objects are kept in insertion order. A calendar is writable by its owner
 * only. Touch operations stamp the {@value #LAST_MODIFIED} property with the current instant.
 *
 * <p>The native capability set is configurable so that degraded backends can be modelled;
 * calling an operation outside that set throws {@link UnsupportedOperationException} exactly
 * like a backend that never implemented it. Subclasses get their own canonical name.
 *
 * <p>All methods are thread-safe.
 */
public class Local implements CalendarBackend {
  public static final String LAST_MODIFIED = "LAST-MODIFIED";

  /**
   * Factory for descriptors of type {@code local}. Each argument names a supported
   * {@link BackendAction}, either as the enum constant or its name; no arguments means all.
   */
  public static final BackendFactory FACTORY = arguments -> new Local(actionsFrom(arguments));

  private final Set<BackendAction> supportedActions;
  private final Clock clock;
  private final Map<String, Calendar> calendars = new LinkedHashMap<>();
  private final Map<String, Map<String, CalendarObject>> objects = new HashMap<>();

  /** Creates a backend supporting every action. */
  public Local() {
    this(EnumSet.allOf(BackendAction.class));
  }

  public Local(Set<BackendAction> supportedActions) {
    this(supportedActions, Clock.systemUTC());
  }

  public Local(Set<BackendAction> supportedActions, Clock clock) {
    Objects.requireNonNull(supportedActions, "supportedActions");
    this.supportedActions = supportedActions.isEmpty()
        ? Collections.unmodifiableSet(EnumSet.noneOf(BackendAction.class))
        : Collections.unmodifiableSet(EnumSet.copyOf(supportedActions));
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Stores a calendar and its objects regardless of the native capability set, replacing
   * any calendar with the same URI. Meant for preloading a backend before it is activated.
   *
   * @param calendar the calendar
   * @param objects  its objects
   * @return this backend for chaining
   */
  public synchronized Local load(Calendar calendar, CalendarObject... objects) {
    Objects.requireNonNull(calendar, "calendar");
    Map<String, CalendarObject> stored = new LinkedHashMap<>();
    for (CalendarObject object : objects) {
      stored.put(object.uid(), object);
    }
    calendars.put(calendar.uri(), calendar);
    this.objects.put(calendar.uri(), stored);
    return this;
  }

  @Override
  public Set<BackendAction> supportedActions() {
    return supportedActions;
  }

  @Override
  public synchronized List<Calendar> getCalendars(String userId) {
    List<Calendar> result = new ArrayList<>();
    for (Calendar calendar : calendars.values()) {
      if (calendar.owner().equals(userId)) {
        result.add(calendar);
      }
    }
    return result;
  }

  @Override
  public synchronized Optional<Calendar> findCalendar(String uri) {
    return Optional.ofNullable(calendars.get(uri));
  }

  @Override
  public synchronized boolean isCalendarWritableByUser(String uri, String userId) {
    Calendar calendar = calendars.get(uri);
    return calendar != null && calendar.owner().equals(userId);
  }

  @Override
  public synchronized List<CalendarObject> getObjects(String uri) {
    Map<String, CalendarObject> stored = objects.get(uri);
    return stored == null ? List.of() : new ArrayList<>(stored.values());
  }

  @Override
  public synchronized Optional<CalendarObject> findObject(String uri, String uid) {
    Map<String, CalendarObject> stored = objects.get(uri);
    return stored == null ? Optional.empty() : Optional.ofNullable(stored.get(uid));
  }

  @Override
  public synchronized List<CalendarObject> getInPeriod(String uri, Instant start, Instant end) {
    require(BackendAction.GET_IN_PERIOD);
    List<CalendarObject> result = new ArrayList<>();
    for (CalendarObject object : getObjects(uri)) {
      if (object.overlaps(start, end)) {
        result.add(object);
      }
    }
    return result;
  }

  @Override
  public synchronized Calendar createCalendar(Calendar calendar) {
    require(BackendAction.CREATE_CALENDAR);
    if (calendars.containsKey(calendar.uri())) {
      throw new IllegalStateException("Calendar already exists: " + calendar.uri());
    }
    calendars.put(calendar.uri(), calendar);
    objects.put(calendar.uri(), new LinkedHashMap<>());
    return calendar;
  }

  @Override
  public synchronized Calendar editCalendar(Calendar calendar) {
    require(BackendAction.EDIT_CALENDAR);
    if (!calendars.containsKey(calendar.uri())) {
      throw new IllegalArgumentException("Calendar not found: " + calendar.uri());
    }
    calendars.put(calendar.uri(), calendar);
    return calendar;
  }

  @Override
  public synchronized boolean deleteCalendar(String uri) {
    require(BackendAction.DELETE_CALENDAR);
    objects.remove(uri);
    return calendars.remove(uri) != null;
  }

  @Override
  public synchronized boolean touchCalendar(String uri) {
    require(BackendAction.TOUCH_CALENDAR);
    Calendar calendar = calendars.get(uri);
    if (calendar == null) {
      return false;
    }
    calendars.put(uri, calendar.toBuilder().property(LAST_MODIFIED, now()).build());
    return true;
  }

  @Override
  public synchronized int mergeCalendar(String destinationUri, String sourceUri) {
    require(BackendAction.MERGE_CALENDAR);
    Map<String, CalendarObject> destination = objects.get(destinationUri);
    if (destination == null) {
      throw new IllegalArgumentException("Calendar not found: " + destinationUri);
    }
    Map<String, CalendarObject> source = objects.getOrDefault(sourceUri, Map.of());
    for (String uid : source.keySet()) {
      if (destination.containsKey(uid)) {
        throw new IllegalStateException("Object " + uid + " already exists in " + destinationUri);
      }
    }
    destination.putAll(source);
    int moved = source.size();
    objects.remove(sourceUri);
    calendars.remove(sourceUri);
    return moved;
  }

  @Override
  public synchronized CalendarObject createObject(String uri, CalendarObject object) {
    require(BackendAction.CREATE_OBJECT);
    Map<String, CalendarObject> stored = objectsOf(uri);
    if (stored.containsKey(object.uid())) {
      throw new IllegalStateException("Object " + object.uid() + " already exists in " + uri);
    }
    stored.put(object.uid(), object);
    return object;
  }

  @Override
  public synchronized CalendarObject editObject(String uri, CalendarObject object) {
    require(BackendAction.EDIT_OBJECT);
    Map<String, CalendarObject> stored = objectsOf(uri);
    if (!stored.containsKey(object.uid())) {
      throw new IllegalArgumentException("Object " + object.uid() + " not found in " + uri);
    }
    stored.put(object.uid(), object);
    return object;
  }

  @Override
  public synchronized boolean deleteObject(String uri, String uid) {
    require(BackendAction.DELETE_OBJECT);
    Map<String, CalendarObject> stored = objects.get(uri);
    return stored != null && stored.remove(uid) != null;
  }

  @Override
  public synchronized boolean touchObject(String uri, String uid) {
    require(BackendAction.TOUCH_OBJECT);
    Map<String, CalendarObject> stored = objects.get(uri);
    CalendarObject object = stored == null ? null : stored.get(uid);
    if (object == null) {
      return false;
    }
    stored.put(uid, object.toBuilder().property(LAST_MODIFIED, now()).build());
    return true;
  }

  @Override
  public synchronized boolean moveObject(String uri, String uid, String destinationUri) {
    require(BackendAction.MOVE_OBJECT);
    Map<String, CalendarObject> source = objects.get(uri);
    if (source == null || !source.containsKey(uid)) {
      return false;
    }
    Map<String, CalendarObject> destination = objectsOf(destinationUri);
    if (destination.containsKey(uid)) {
      throw new IllegalStateException("Object " + uid + " already exists in " + destinationUri);
    }
    destination.put(uid, source.remove(uid));
    return true;
  }

  private Map<String, CalendarObject> objectsOf(String uri) {
    Map<String, CalendarObject> stored = objects.get(uri);
    if (stored == null) {
      throw new IllegalArgumentException("Calendar not found: " + uri);
    }
    return stored;
  }

  private void require(BackendAction action) {
    if (!supportedActions.contains(action)) {
      throw new UnsupportedOperationException(action.name());
    }
  }

  private String now() {
    return clock.instant().toString();
  }

  private static Set<BackendAction> actionsFrom(List<Object> arguments) {
    if (arguments.isEmpty()) {
      return EnumSet.allOf(BackendAction.class);
    }
    Set<BackendAction> actions = EnumSet.noneOf(BackendAction.class);
    for (Object argument : arguments) {
      if (argument instanceof BackendAction action) {
        actions.add(action);
      } else if (argument instanceof String name) {
        actions.add(BackendAction.valueOf(name.trim().toUpperCase(Locale.ROOT)));
      } else {
        throw new IllegalArgumentException("Expected a backend action but got " + argument);
      }
    }
    return actions;
  }
}
