package calendar.dispatch;

/**
 * How the federation layer carries out an operation on a given backend.
 */
public enum Negotiation {
  /** The backend implements the operation natively. */
  DELEGATE,
  /** The backend lacks it; the federation layer completes it by other means. */
  EMULATE,
  /** The backend lacks it and there is no fallback. */
  UNSUPPORTED
}
