package calendar;

/**
 * Thrown when an object offered for activation does not implement the backend
 * capability surface, or when a backend factory cannot produce one.
 */
public final class InvalidBackendException extends CalendarFederationException {

  public InvalidBackendException(String message) {
    super(message);
  }

  public InvalidBackendException(String message, Throwable cause) {
    super(message, cause);
  }
}
