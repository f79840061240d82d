package calendar;

/**
 * Thrown when a composite identifier does not split into exactly two or three
 * non-empty segments.
 */
public final class MalformedIdentifierException extends CalendarFederationException {
  private final String identifier;

  public MalformedIdentifierException(String identifier, String reason) {
    super("Malformed identifier '" + identifier + "': " + reason);
    this.identifier = identifier;
  }

  public String identifier() {
    return identifier;
  }
}
