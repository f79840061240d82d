package calendar.spi;

import java.util.Map;
import java.util.Optional;

/**
 * Maps bare object UIDs to the composite identifier of the object that was last observed
 * with that UID.
 *
 * <p>Populated lazily by the dispatcher whenever it returns or stores an object. An entry
 * may outlive the object when the object is removed behind the federation layer's back;
 * lookups through the dispatcher then report the object as not found.
 *
 * <p>Implementations must tolerate concurrent {@link #put} calls for the same UID; the last
 * one wins.
 */
public interface UidIndex {

  /**
   * Records or replaces the entry for {@code uid}.
   */
  void put(String uid, String objectId);

  /**
   * Records or replaces an entry per map key.
   *
   * @param entries UID to composite object identifier
   */
  default void putAll(Map<String, String> entries) {
    entries.forEach(this::put);
  }

  Optional<String> lookup(String uid);

  /**
   * Removes the entry for {@code uid} if it still points at {@code objectId}.
   */
  void remove(String uid, String objectId);
}
