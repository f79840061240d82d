package calendar.spi;

/**
 * Operation kinds a backend may implement natively.
 *
 * <p>Read operations other than {@link #GET_IN_PERIOD} are mandatory for every backend
 * and are not listed here.
 *
 * @see CalendarBackend#supports(BackendAction)
 */
public enum BackendAction {
  CREATE_CALENDAR,
  EDIT_CALENDAR,
  DELETE_CALENDAR,
  TOUCH_CALENDAR,
  MERGE_CALENDAR,
  CREATE_OBJECT,
  EDIT_OBJECT,
  DELETE_OBJECT,
  TOUCH_OBJECT,
  MOVE_OBJECT,
  GET_IN_PERIOD
}
