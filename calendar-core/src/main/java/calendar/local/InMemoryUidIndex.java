package calendar.local;

import calendar.spi.UidIndex;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link UidIndex} backed by a {@link ConcurrentHashMap}.
 */
public final class InMemoryUidIndex implements UidIndex {
  private final Map<String, String> entries = new ConcurrentHashMap<>();

  @Override
  public void put(String uid, String objectId) {
    entries.put(Objects.requireNonNull(uid, "uid"), Objects.requireNonNull(objectId, "objectId"));
  }

  @Override
  public Optional<String> lookup(String uid) {
    return uid == null ? Optional.empty() : Optional.ofNullable(entries.get(uid));
  }

  @Override
  public void remove(String uid, String objectId) {
    entries.remove(uid, objectId);
  }
}
