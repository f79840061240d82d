package calendar.dispatch;

import calendar.registry.BackendRegistry;
import calendar.spi.BackendAction;
import calendar.spi.CalendarBackend;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Decides whether an operation is delegated to a backend, emulated, or unsupported.
 *
 * <p>Emulation exists for deletes (hide in place), period listing (local filtering),
 * calendar merges and object moves (decomposed into create and delete). Every other
 * operation is unsupported when the backend does not advertise it.
 */
public final class CapabilityNegotiator {
  private static final Set<BackendAction> EMULABLE = EnumSet.of(
      BackendAction.DELETE_CALENDAR,
      BackendAction.DELETE_OBJECT,
      BackendAction.GET_IN_PERIOD,
      BackendAction.MERGE_CALENDAR,
      BackendAction.MOVE_OBJECT);

  private final BackendRegistry registry;

  public CapabilityNegotiator(BackendRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  /**
   * Returns {@code true} if {@code backend} implements {@code action} natively.
   */
  public boolean supports(CalendarBackend backend, BackendAction action) {
    Objects.requireNonNull(action, "action");
    return backend.supports(action);
  }

  /**
   * Returns {@code true} if the activated backend named {@code backendName} implements
   * {@code action} natively; {@code false} when no such backend is activated.
   */
  public boolean supports(String backendName, BackendAction action) {
    return registry.find(backendName)
        .map(backend -> supports(backend, action))
        .orElse(false);
  }

  public Negotiation negotiate(CalendarBackend backend, BackendAction action) {
    if (supports(backend, action)) {
      return Negotiation.DELEGATE;
    }
    return EMULABLE.contains(action) ? Negotiation.EMULATE : Negotiation.UNSUPPORTED;
  }

  /** Returns {@code true} if the federation layer has a fallback for {@code action}. */
  public static boolean isEmulable(BackendAction action) {
    return EMULABLE.contains(action);
  }
}
