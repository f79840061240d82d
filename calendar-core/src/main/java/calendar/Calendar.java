package calendar;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable calendar as exchanged between backends and callers.
 *
 * <p>A backend returns calendars with only a backend-local {@linkplain #uri() URI}. The
 * federation layer {@linkplain #tag(String) tags} every calendar it hands out with the
 * canonical name of the owning backend and stores the composite identifier in the
 * {@value #CALENDAR_ID_PROPERTY} property. Tagging depends only on (backend, uri), so
 * applying it twice yields an equal calendar.
 *
 * @see ObjectId
 */
public final class Calendar {
  public static final String CALENDAR_ID_PROPERTY = "X-CALENDAR-ID";

  private final String uri;
  private final String owner;
  private final String displayName;
  private final boolean active;
  private final Map<String, String> properties;
  private final String backend;

  private Calendar(Builder builder) {
    this.uri = Objects.requireNonNull(builder.uri, "uri");
    if (uri.isEmpty()) {
      throw new IllegalArgumentException("uri cannot be empty");
    }
    this.owner = Objects.requireNonNull(builder.owner, "owner");
    this.displayName = builder.displayName == null ? uri : builder.displayName;
    this.active = builder.active;
    Map<String, String> copy = new LinkedHashMap<>(builder.properties);
    if (copy.containsKey(null) || copy.containsValue(null)) {
      throw new IllegalArgumentException("properties cannot contain null keys or values");
    }
    this.properties = Collections.unmodifiableMap(copy);
    this.backend = builder.backend;
  }

  /**
   * Creates a builder for a calendar with the given backend-local URI.
   *
   * @param uri the calendar URI, unique within its backend
   * @return a new builder
   */
  public static Builder builder(String uri) {
    return new Builder(uri);
  }

  public String uri() {
    return uri;
  }

  public String owner() {
    return owner;
  }

  public String displayName() {
    return displayName;
  }

  /** Returns {@code false} when the calendar is flagged disabled. */
  public boolean active() {
    return active;
  }

  public Map<String, String> properties() {
    return properties;
  }

  public Optional<String> property(String name) {
    return Optional.ofNullable(properties.get(name));
  }

  /** Returns the canonical name of the owning backend, once tagged. */
  public Optional<String> backend() {
    return Optional.ofNullable(backend);
  }

  /**
   * Returns the composite identifier ({@code backend.uri}), once tagged.
   */
  public Optional<String> calendarId() {
    return backend == null ? Optional.empty() : Optional.of(ObjectId.encode(backend, uri));
  }

  /**
   * Returns a copy owned by {@code backendName}, with the composite identifier recorded
   * in the {@value #CALENDAR_ID_PROPERTY} property.
   *
   * @param backendName canonical backend name
   * @return the tagged calendar
   * @throws InvalidSegmentException if the backend name or URI cannot form an identifier
   */
  public Calendar tag(String backendName) {
    String calendarId = ObjectId.encode(backendName, uri);
    return toBuilder()
        .backend(backendName)
        .property(CALENDAR_ID_PROPERTY, calendarId)
        .build();
  }

  /**
   * Returns a builder pre-populated with this calendar's state.
   */
  public Builder toBuilder() {
    return new Builder(uri)
        .owner(owner)
        .displayName(displayName)
        .active(active)
        .properties(properties)
        .backend(backend);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Calendar other)) return false;
    return active == other.active
        && uri.equals(other.uri)
        && owner.equals(other.owner)
        && displayName.equals(other.displayName)
        && properties.equals(other.properties)
        && Objects.equals(backend, other.backend);
  }

  @Override
  public int hashCode() {
    return Objects.hash(uri, owner, displayName, active, properties, backend);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("Calendar{uri=").append(uri)
        .append(", owner=").append(owner)
        .append(", active=").append(active);
    if (backend != null) {
      sb.append(", backend=").append(backend);
    }
    return sb.append('}').toString();
  }

  /**
   * Builder for {@link Calendar}.
   */
  public static final class Builder {
    private final String uri;
    private String owner;
    private String displayName;
    private boolean active = true;
    private final Map<String, String> properties = new LinkedHashMap<>();
    private String backend;

    private Builder(String uri) {
      this.uri = uri;
    }

    /**
     * Sets the owning user.
     *
     * <p><b>Required.</b>
     *
     * @param owner the user id of the owner
     * @return this builder
     */
    public Builder owner(String owner) {
      this.owner = owner;
      return this;
    }

    /**
     * Sets the display name.
     *
     * <p>Optional. Defaults to the URI.
     *
     * @param displayName the display name
     * @return this builder
     */
    public Builder displayName(String displayName) {
      this.displayName = displayName;
      return this;
    }

    /**
     * Sets whether the calendar is enabled.
     *
     * <p>Optional. Defaults to {@code true}.
     *
     * @param active {@code false} to flag the calendar disabled
     * @return this builder
     */
    public Builder active(boolean active) {
      this.active = active;
      return this;
    }

    /**
     * Sets a single property, replacing any previous value.
     *
     * @param name  property name
     * @param value property value
     * @return this builder
     */
    public Builder property(String name, String value) {
      this.properties.put(name, value);
      return this;
    }

    /**
     * Adds all given properties, replacing previous values with the same name.
     *
     * @param properties properties to add
     * @return this builder
     */
    public Builder properties(Map<String, String> properties) {
      this.properties.putAll(properties);
      return this;
    }

    Builder backend(String backend) {
      this.backend = backend;
      return this;
    }

    public Calendar build() {
      return new Calendar(this);
    }
  }
}
