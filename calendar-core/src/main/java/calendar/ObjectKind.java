package calendar;

/**
 * Component type of a calendar object.
 */
public enum ObjectKind {
  EVENT,
  JOURNAL,
  TODO
}
