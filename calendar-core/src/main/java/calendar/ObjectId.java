package calendar;

import java.util.Objects;
import java.util.Optional;

/**
 * Composite identifier addressing a calendar or a calendar object across backends.
 *
 * <p>The external form is {@code backend.calendar} for a calendar and
 * {@code backend.calendar.object} for an object inside it. Segments are
 * case-sensitive, non-empty, and may not contain the {@value #DELIMITER} delimiter.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ObjectId id = ObjectId.decode("database.personal.7sm626oar9a7t5k4p4ljhlnqbk");
 * id.backend();     // "database"
 * id.calendar();    // "personal"
 * id.object();      // Optional["7sm626oar9a7t5k4p4ljhlnqbk"]
 * id.calendarId();  // "database.personal"
 *
 * String objectId = ObjectId.encode("database", "personal", "abc"); // "database.personal.abc"
 * }</pre>
 *
 * @param backend  canonical name of the owning backend
 * @param calendar backend-local calendar URI
 * @param uid      object UID, or {@code null} when this identifier addresses a calendar
 */
public record ObjectId(String backend, String calendar, String uid) {
  public static final char DELIMITER = '.';

  public ObjectId {
    checkSegment("backend", backend);
    checkSegment("calendar", calendar);
    if (uid != null) {
      checkSegment("object", uid);
    }
  }

  /**
   * Creates an identifier addressing a calendar.
   *
   * @throws InvalidSegmentException if a segment is empty or contains the delimiter
   */
  public static ObjectId of(String backend, String calendar) {
    return new ObjectId(backend, calendar, null);
  }

  /**
   * Creates an identifier addressing an object inside a calendar.
   *
   * @throws InvalidSegmentException if a segment is empty or contains the delimiter
   */
  public static ObjectId of(String backend, String calendar, String uid) {
    Objects.requireNonNull(uid, "uid");
    return new ObjectId(backend, calendar, uid);
  }

  /**
   * Encodes a calendar identifier.
   *
   * @throws InvalidSegmentException if a segment is empty or contains the delimiter
   */
  public static String encode(String backend, String calendar) {
    return of(backend, calendar).toString();
  }

  /**
   * Encodes an object identifier. A {@code null} uid yields the calendar form.
   *
   * @throws InvalidSegmentException if a segment is empty or contains the delimiter
   */
  public static String encode(String backend, String calendar, String uid) {
    return new ObjectId(backend, calendar, uid).toString();
  }

  /**
   * Decodes a two- or three-segment identifier.
   *
   * @param id the external identifier
   * @return the decoded identifier
   * @throws MalformedIdentifierException unless {@code id} splits into exactly
   *     2 or 3 non-empty segments
   */
  public static ObjectId decode(String id) {
    if (id == null) {
      throw new MalformedIdentifierException(null, "identifier is null");
    }
    String[] segments = id.split("\\" + DELIMITER, -1);
    if (segments.length != 2 && segments.length != 3) {
      throw new MalformedIdentifierException(id,
          "expected 2 or 3 segments but found " + segments.length);
    }
    for (String segment : segments) {
      if (segment.isEmpty()) {
        throw new MalformedIdentifierException(id, "empty segment");
      }
    }
    return new ObjectId(segments[0], segments[1], segments.length == 3 ? segments[2] : null);
  }

  /**
   * Decodes an identifier that must address an object.
   *
   * @throws MalformedIdentifierException if {@code id} is malformed or has no object segment
   */
  public static ObjectId decodeObject(String id) {
    ObjectId decoded = decode(id);
    if (!decoded.isObject()) {
      throw new MalformedIdentifierException(id, "object segment is missing");
    }
    return decoded;
  }

  /**
   * Decodes an identifier that must address a calendar.
   *
   * @throws MalformedIdentifierException if {@code id} is malformed or has an object segment
   */
  public static ObjectId decodeCalendar(String id) {
    ObjectId decoded = decode(id);
    if (decoded.isObject()) {
      throw new MalformedIdentifierException(id, "calendar identifier must have two segments");
    }
    return decoded;
  }

  /** Returns the object segment, empty for calendar identifiers. */
  public Optional<String> object() {
    return Optional.ofNullable(uid);
  }

  /** Returns {@code true} when this identifier addresses an object. */
  public boolean isObject() {
    return uid != null;
  }

  /** Returns the two-segment identifier of the calendar this identifier belongs to. */
  public String calendarId() {
    return backend + DELIMITER + calendar;
  }

  /** Returns an identifier for {@code uid} inside this identifier's calendar. */
  public ObjectId withObject(String uid) {
    return of(backend, calendar, uid);
  }

  @Override
  public String toString() {
    return uid == null ? calendarId() : calendarId() + DELIMITER + uid;
  }

  private static void checkSegment(String name, String value) {
    if (value == null || value.isEmpty()) {
      throw new InvalidSegmentException(name, value, "segment must not be empty");
    }
    if (value.indexOf(DELIMITER) >= 0) {
      throw new InvalidSegmentException(name, value,
          "segment must not contain '" + DELIMITER + "'");
    }
  }
}
