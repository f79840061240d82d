package calendar.registry;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of {@link BackendRegistry#setupAll()}.
 *
 * @param activated descriptors whose backend was constructed and activated, in descriptor order
 * @param skipped   descriptors that could not be set up, in descriptor order
 */
public record SetupReport(List<Activated> activated, List<Skipped> skipped) {

  public SetupReport {
    activated = List.copyOf(activated);
    skipped = List.copyOf(skipped);
  }

  /** Returns {@code true} when no descriptor was skipped. */
  public boolean isComplete() {
    return skipped.isEmpty();
  }

  /**
   * @param descriptor    the descriptor that was set up
   * @param canonicalName the name the constructed backend was activated under
   */
  public record Activated(BackendDescriptor descriptor, String canonicalName) {
    public Activated {
      Objects.requireNonNull(descriptor, "descriptor");
      Objects.requireNonNull(canonicalName, "canonicalName");
    }
  }

  /**
   * @param descriptor the descriptor that was skipped
   * @param reason     why it was skipped
   */
  public record Skipped(BackendDescriptor descriptor, String reason) {
    public Skipped {
      Objects.requireNonNull(descriptor, "descriptor");
      Objects.requireNonNull(reason, "reason");
    }
  }
}
