package calendar;

/**
 * Thrown by {@link OperationResult#orElseThrow()} for callers that prefer
 * interruption over checking the returned result.
 */
public final class FederationOperationException extends CalendarFederationException {
  private final FailureReason reason;

  public FederationOperationException(FailureReason reason, String message) {
    super(reason + ": " + message);
    this.reason = reason;
  }

  public FailureReason reason() {
    return reason;
  }
}
