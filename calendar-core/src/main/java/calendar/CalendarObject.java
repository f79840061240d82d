package calendar;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable calendar object (event, journal, or to-do), unique within its calendar by {@link #uid()}.
 *
 * <p>The object content is carried as an opaque property map; this layer does not parse it.
 * The optional {@linkplain #start() start} and {@linkplain #end() end} instants are the
 * object's time bounds, used when listing objects in a period.
 *
 * <p>Objects returned by the federation layer are {@linkplain #tag(String, String) tagged}
 * with their derived composite identifier {@code backend.calendar.uid}.
 */
public final class CalendarObject {

  private final String uid;
  private final ObjectKind kind;
  private final Instant start;
  private final Instant end;
  private final Map<String, String> properties;
  private final String objectId;

  private CalendarObject(Builder builder) {
    this.uid = builder.uid == null ? newUid() : builder.uid;
    if (uid.isEmpty()) {
      throw new IllegalArgumentException("uid cannot be empty");
    }
    this.kind = builder.kind == null ? ObjectKind.EVENT : builder.kind;
    this.start = builder.start;
    this.end = builder.end;
    if (start == null && end != null) {
      throw new IllegalArgumentException("end requires start");
    }
    if (start != null && end != null && end.isBefore(start)) {
      throw new IllegalArgumentException("end must not be before start");
    }
    Map<String, String> copy = new LinkedHashMap<>(builder.properties);
    if (copy.containsKey(null) || copy.containsValue(null)) {
      throw new IllegalArgumentException("properties cannot contain null keys or values");
    }
    this.properties = Collections.unmodifiableMap(copy);
    this.objectId = builder.objectId;
  }

  /**
   * Creates a builder for an object with a generated ULID as its UID.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a builder for an object with the given UID.
   *
   * @param uid the object UID
   * @return a new builder
   */
  public static Builder builder(String uid) {
    return new Builder().uid(Objects.requireNonNull(uid, "uid"));
  }

  public String uid() {
    return uid;
  }

  public ObjectKind kind() {
    return kind;
  }

  public Optional<Instant> start() {
    return Optional.ofNullable(start);
  }

  /**
   * Returns the end of the object's time bounds. An object with a start but no end
   * is instantaneous.
   */
  public Optional<Instant> end() {
    return Optional.ofNullable(end);
  }

  public Map<String, String> properties() {
    return properties;
  }

  public Optional<String> property(String name) {
    return Optional.ofNullable(properties.get(name));
  }

  /** Returns the composite identifier ({@code backend.calendar.uid}), once tagged. */
  public Optional<String> objectId() {
    return Optional.ofNullable(objectId);
  }

  /**
   * Returns {@code true} when this object's time bounds intersect {@code [from, to]},
   * both ends inclusive. Objects without a start never intersect a period.
   *
   * @param from period start
   * @param to   period end
   */
  public boolean overlaps(Instant from, Instant to) {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
    if (start == null) {
      return false;
    }
    Instant effectiveEnd = end == null ? start : end;
    return !start.isAfter(to) && !effectiveEnd.isBefore(from);
  }

  /**
   * Returns a copy carrying the derived identifier {@code backend.calendarUri.uid}.
   *
   * @throws InvalidSegmentException if the parts cannot form an identifier
   */
  public CalendarObject tag(String backend, String calendarUri) {
    String id = ObjectId.encode(backend, calendarUri, uid);
    if (id.equals(objectId)) {
      return this;
    }
    return toBuilder().objectId(id).build();
  }

  /**
   * Returns a builder pre-populated with this object's state.
   */
  public Builder toBuilder() {
    return new Builder()
        .uid(uid)
        .kind(kind)
        .start(start)
        .end(end)
        .properties(properties)
        .objectId(objectId);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof CalendarObject other)) return false;
    return uid.equals(other.uid)
        && kind == other.kind
        && Objects.equals(start, other.start)
        && Objects.equals(end, other.end)
        && properties.equals(other.properties)
        && Objects.equals(objectId, other.objectId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(uid, kind, start, end, properties, objectId);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("CalendarObject{uid=").append(uid)
        .append(", kind=").append(kind);
    if (start != null) {
      sb.append(", start=").append(start);
    }
    if (end != null) {
      sb.append(", end=").append(end);
    }
    if (objectId != null) {
      sb.append(", objectId=").append(objectId);
    }
    return sb.append('}').toString();
  }

  private static String newUid() {
    return UlidCreator.getMonotonicUlid().toString();
  }

  /**
   * Builder for {@link CalendarObject}.
   */
  public static final class Builder {
    private String uid;
    private ObjectKind kind;
    private Instant start;
    private Instant end;
    private final Map<String, String> properties = new LinkedHashMap<>();
    private String objectId;

    private Builder() {}

    /**
     * Sets the UID.
     *
     * <p>Optional. Defaults to a monotonic ULID.
     *
     * @param uid the object UID
     * @return this builder
     */
    public Builder uid(String uid) {
      this.uid = uid;
      return this;
    }

    /**
     * Sets the component type.
     *
     * <p>Optional. Defaults to {@link ObjectKind#EVENT}.
     *
     * @param kind the component type
     * @return this builder
     */
    public Builder kind(ObjectKind kind) {
      this.kind = kind;
      return this;
    }

    public Builder start(Instant start) {
      this.start = start;
      return this;
    }

    public Builder end(Instant end) {
      this.end = end;
      return this;
    }

    public Builder property(String name, String value) {
      this.properties.put(name, value);
      return this;
    }

    public Builder properties(Map<String, String> properties) {
      this.properties.putAll(properties);
      return this;
    }

    Builder objectId(String objectId) {
      this.objectId = objectId;
      return this;
    }

    public CalendarObject build() {
      return new CalendarObject(this);
    }
  }
}
