package calendar;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Filters applied when listing a user's calendars.
 *
 * <p>{@code activeOnly} and {@code writableOnly} are applied independently, in that order.
 * A {@code backends} subset restricts the listing to the named backends; without one,
 * every activated backend is consulted.
 *
 * <pre>{@code
 * CalendarFilter.all();
 * CalendarFilter.builder().activeOnly().writableOnly().backends("database").build();
 * }</pre>
 */
public final class CalendarFilter {
  private static final CalendarFilter ALL = new CalendarFilter(false, false, null);

  private final boolean activeOnly;
  private final boolean writableOnly;
  private final Set<String> backends;

  private CalendarFilter(boolean activeOnly, boolean writableOnly, Set<String> backends) {
    this.activeOnly = activeOnly;
    this.writableOnly = writableOnly;
    this.backends = backends == null ? null : Collections.unmodifiableSet(backends);
  }

  /** Returns a filter that keeps every calendar of every activated backend. */
  public static CalendarFilter all() {
    return ALL;
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean activeOnly() {
    return activeOnly;
  }

  public boolean writableOnly() {
    return writableOnly;
  }

  /** Returns the backend subset in caller order, empty when all backends are in scope. */
  public Optional<Set<String>> backends() {
    return Optional.ofNullable(backends);
  }

  @Override
  public String toString() {
    return "CalendarFilter{activeOnly=" + activeOnly
        + ", writableOnly=" + writableOnly
        + ", backends=" + backends + '}';
  }

  /**
   * Builder for {@link CalendarFilter}.
   */
  public static final class Builder {
    private boolean activeOnly;
    private boolean writableOnly;
    private Set<String> backends;

    private Builder() {}

    /** Drops calendars flagged disabled. */
    public Builder activeOnly() {
      this.activeOnly = true;
      return this;
    }

    /** Drops calendars the backend reports as not writable by the listing user. */
    public Builder writableOnly() {
      this.writableOnly = true;
      return this;
    }

    public Builder backends(String... backends) {
      return backends(Arrays.asList(backends));
    }

    public Builder backends(Collection<String> backends) {
      Objects.requireNonNull(backends, "backends");
      if (this.backends == null) {
        this.backends = new LinkedHashSet<>();
      }
      for (String backend : backends) {
        this.backends.add(Objects.requireNonNull(backend, "backend"));
      }
      return this;
    }

    public CalendarFilter build() {
      return new CalendarFilter(activeOnly, writableOnly,
          backends == null ? null : new LinkedHashSet<>(backends));
    }
  }
}
