package calendar;

/**
 * Base class for the unchecked exceptions thrown by the federation layer.
 *
 * <p>Identifier and registry errors surface immediately as subclasses of this type.
 * Backend outcomes are never thrown; they come back as {@link OperationResult} values.
 */
public class CalendarFederationException extends RuntimeException {

  public CalendarFederationException(String message) {
    super(message);
  }

  public CalendarFederationException(String message, Throwable cause) {
    super(message, cause);
  }
}
