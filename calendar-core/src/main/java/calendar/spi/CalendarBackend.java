package calendar.spi;

import calendar.Calendar;
import calendar.CalendarObject;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Storage backend that owns a set of calendars and their objects.
 *
 * <p>Backends address calendars by their backend-local URI only; the federation layer adds
 * the backend segment and tags returned values. The read operations are mandatory. The
 * mutating operations and {@link #getInPeriod} are optional: a backend advertises the ones it
 * implements through {@link #supportedActions()}, and the default method bodies throw
 * {@link UnsupportedOperationException}.
 *
 * <p>Implementations must be safe for concurrent reads. Any runtime exception thrown by a
 * backend is reported to callers as a failed result, never propagated.
 *
 * <p>The canonical name of an activated backend is the lowercased simple name of its
 * concrete class, so each implementation class yields exactly one activated instance.
 *
 * @see BackendAction
 * @see calendar.registry.BackendRegistry
 */
public interface CalendarBackend {

  /**
   * Returns every calendar owned by {@code userId}, in the backend's own order.
   *
   * @param userId the user id
   * @return calendars, may be empty
   */
  List<Calendar> getCalendars(String userId);

  /**
   * Looks up a calendar by its backend-local URI.
   *
   * @param uri the calendar URI
   * @return the calendar, or empty if it does not exist
   */
  Optional<Calendar> findCalendar(String uri);

  /**
   * Returns {@code true} if {@code userId} may write to the calendar.
   *
   * @param uri    the calendar URI
   * @param userId the user id
   */
  boolean isCalendarWritableByUser(String uri, String userId);

  /**
   * Returns every object in the calendar.
   *
   * @param uri the calendar URI
   * @return objects, empty when the calendar has none or does not exist
   */
  List<CalendarObject> getObjects(String uri);

  /**
   * Looks up one object.
   *
   * @param uri the calendar URI
   * @param uid the object UID
   * @return the object, or empty if it does not exist
   */
  Optional<CalendarObject> findObject(String uri, String uid);

  /**
   * Returns the native capability set of this backend.
   *
   * @return the supported actions, never {@code null}
   */
  Set<BackendAction> supportedActions();

  /**
   * Returns {@code true} if {@code action} is implemented natively.
   */
  default boolean supports(BackendAction action) {
    return supportedActions().contains(action);
  }

  /**
   * Returns objects whose time bounds intersect {@code [start, end]}, both inclusive.
   * Requires {@link BackendAction#GET_IN_PERIOD}.
   */
  default List<CalendarObject> getInPeriod(String uri, Instant start, Instant end) {
    throw new UnsupportedOperationException("getInPeriod");
  }

  /**
   * Creates a calendar. Requires {@link BackendAction#CREATE_CALENDAR}.
   *
   * @return the stored calendar
   */
  default Calendar createCalendar(Calendar calendar) {
    throw new UnsupportedOperationException("createCalendar");
  }

  /**
   * Replaces the stored state of the calendar with the same URI.
   * Requires {@link BackendAction#EDIT_CALENDAR}.
   *
   * @return the stored calendar
   * @throws IllegalArgumentException if no such calendar exists
   */
  default Calendar editCalendar(Calendar calendar) {
    throw new UnsupportedOperationException("editCalendar");
  }

  /**
   * Deletes a calendar and all its objects. Requires {@link BackendAction#DELETE_CALENDAR}.
   *
   * @return {@code false} if the calendar did not exist
   */
  default boolean deleteCalendar(String uri) {
    throw new UnsupportedOperationException("deleteCalendar");
  }

  /**
   * Marks the calendar modified without changing its content.
   * Requires {@link BackendAction#TOUCH_CALENDAR}.
   *
   * @return {@code false} if the calendar did not exist
   */
  default boolean touchCalendar(String uri) {
    throw new UnsupportedOperationException("touchCalendar");
  }

  /**
   * Moves every object of {@code sourceUri} into {@code destinationUri} and deletes the source.
   * Requires {@link BackendAction#MERGE_CALENDAR}.
   *
   * @return the number of objects moved
   */
  default int mergeCalendar(String destinationUri, String sourceUri) {
    throw new UnsupportedOperationException("mergeCalendar");
  }

  /**
   * Stores a new object. Requires {@link BackendAction#CREATE_OBJECT}.
   *
   * @return the stored object
   */
  default CalendarObject createObject(String uri, CalendarObject object) {
    throw new UnsupportedOperationException("createObject");
  }

  /**
   * Replaces the object with the same UID. Requires {@link BackendAction#EDIT_OBJECT}.
   *
   * @return the stored object
   * @throws IllegalArgumentException if the calendar or the object does not exist
   */
  default CalendarObject editObject(String uri, CalendarObject object) {
    throw new UnsupportedOperationException("editObject");
  }

  /**
   * Deletes an object. Requires {@link BackendAction#DELETE_OBJECT}.
   *
   * @return {@code false} if the object did not exist
   */
  default boolean deleteObject(String uri, String uid) {
    throw new UnsupportedOperationException("deleteObject");
  }

  /**
   * Marks the object modified without changing its content.
   * Requires {@link BackendAction#TOUCH_OBJECT}.
   *
   * @return {@code false} if the object did not exist
   */
  default boolean touchObject(String uri, String uid) {
    throw new UnsupportedOperationException("touchObject");
  }

  /**
   * Moves an object between two calendars of this backend.
   * Requires {@link BackendAction#MOVE_OBJECT}.
   *
   * @return {@code false} if the object did not exist
   */
  default boolean moveObject(String uri, String uid, String destinationUri) {
    throw new UnsupportedOperationException("moveObject");
  }
}
