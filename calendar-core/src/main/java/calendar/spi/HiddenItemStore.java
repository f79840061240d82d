package calendar.spi;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Remembers calendars and objects that were deleted by hiding them, because their backend
 * cannot delete natively.
 *
 * <p>Identifiers are composite ({@code backend.calendar} and {@code backend.calendar.uid}).
 * A hidden calendar hides every object inside it.
 */
public interface HiddenItemStore {

  void hideCalendar(String calendarId);

  void hideObject(String objectId);

  boolean isCalendarHidden(String calendarId);

  /**
   * Returns {@code true} if the object itself is hidden. Callers check the enclosing
   * calendar separately.
   */
  boolean isObjectHidden(String objectId);

  /**
   * Returns the subset of {@code objectIds} that is hidden. Stores with a remote backing
   * should answer this with a single round trip.
   *
   * @param objectIds composite object identifiers
   * @return the hidden ones, never {@code null}
   */
  default Set<String> hiddenObjects(Collection<String> objectIds) {
    Set<String> hidden = new LinkedHashSet<>();
    for (String objectId : objectIds) {
      if (isObjectHidden(objectId)) {
        hidden.add(objectId);
      }
    }
    return hidden;
  }
}
