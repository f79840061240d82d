package calendar;

/**
 * Thrown when a value cannot be used as an identifier segment because it is empty
 * or contains the {@link ObjectId#DELIMITER delimiter}.
 */
public final class InvalidSegmentException extends CalendarFederationException {
  private final String segmentName;
  private final String value;

  public InvalidSegmentException(String segmentName, String value, String reason) {
    super("Invalid " + segmentName + " segment '" + value + "': " + reason);
    this.segmentName = segmentName;
    this.value = value;
  }

  public String segmentName() {
    return segmentName;
  }

  public String value() {
    return value;
  }
}
