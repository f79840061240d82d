package calendar.registry;

import calendar.spi.CalendarBackend;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Holds backend descriptors and activated backend instances.
 *
 * <p>Descriptors are appended at configuration time and never constructed until
 * {@link #setupAll()}. Activated backends are keyed by canonical name, the lowercased
 * simple class name of the instance; at most one instance exists per canonical name.
 *
 * <p>Reads are safe at any time. {@link #activate}, {@link #setupAll()} and {@link #reset()}
 * are meant for the setup phase and need external exclusion if called while serving.
 *
 * @see DefaultBackendRegistry
 */
public interface BackendRegistry {

  /**
   * Appends a descriptor. Constructs nothing; descriptors with equal names are all kept.
   *
   * @param descriptor the descriptor
   * @return this registry for chaining
   */
  BackendRegistry register(BackendDescriptor descriptor);

  /**
   * Constructs and activates the configured default backend.
   *
   * @return the canonical name of the activated backend
   */
  String activate();

  /**
   * Activates an already constructed backend, replacing any backend with the same
   * canonical name.
   *
   * @param backend the backend instance
   * @return its canonical name
   * @throws calendar.InvalidBackendException if {@code backend} is not a {@link CalendarBackend}
   *     or its class is anonymous
   */
  String activate(Object backend);

  /**
   * Constructs and activates every descriptor that was not set up before. Descriptors whose
   * type has no factory, or whose factory fails, are skipped and reported.
   *
   * @return which descriptors were activated and which were skipped
   */
  SetupReport setupAll();

  /**
   * Removes all activated backends. Descriptors are kept and may be set up again.
   */
  void reset();

  /** Returns the registered descriptors in registration order. */
  List<BackendDescriptor> listDescriptors();

  /** Returns the canonical names of the activated backends in first-activation order. */
  List<String> listActivatedNames();

  /**
   * Looks up an activated backend.
   *
   * @param canonicalName the backend name
   * @return the backend, or empty if none is activated under that name
   */
  Optional<CalendarBackend> find(String canonicalName);

  /**
   * Returns the canonical name for a backend instance.
   *
   * @param backend the backend
   * @return the lowercased simple class name, empty for an anonymous class
   */
  static String canonicalName(CalendarBackend backend) {
    return backend.getClass().getSimpleName().toLowerCase(Locale.ROOT);
  }
}
