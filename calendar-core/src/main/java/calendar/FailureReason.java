package calendar;

/**
 * Why a federated operation did not succeed.
 */
public enum FailureReason {
  /** The identifier names a backend that is not activated. */
  BACKEND_NOT_FOUND,
  /** The backend does not implement the operation and no fallback exists. */
  UNSUPPORTED_OPERATION,
  /** The backend attempted the operation and reported failure. */
  BACKEND_OPERATION_FAILED,
  /** The UID has not been observed yet, so it cannot be resolved to an identifier. */
  UID_NOT_INDEXED,
  /** The addressed calendar or object does not exist. Absence, not a fault. */
  NOT_FOUND
}
