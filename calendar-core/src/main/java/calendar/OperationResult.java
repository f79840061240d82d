package calendar;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a federated operation.
 *
 * <ul>
 *   <li>{@link Success}: the operation completed, possibly through a degraded path
 *       such as hiding instead of deleting.</li>
 *   <li>{@link Failure}: the operation did not complete; {@link Failure#reason()} tells why.</li>
 * </ul>
 *
 * <p>Backend-reported failures never propagate as exceptions. Callers check the result,
 * or call {@link #orElseThrow()} to opt into interruption.
 *
 * @param <T> the value type carried by a success
 */
public sealed interface OperationResult<T> permits OperationResult.Success, OperationResult.Failure {

  /**
   * Creates a successful result carrying {@code value}.
   *
   * @param value the result value, may be {@code null} for {@code Void} results
   * @return a success
   */
  static <T> Success<T> success(T value) {
    return new Success<>(value);
  }

  /**
   * Creates a successful result with no value.
   *
   * @return a success
   */
  static Success<Void> done() {
    return new Success<>(null);
  }

  /**
   * Creates a failed result.
   *
   * @param reason  why the operation failed
   * @param message human-readable detail
   * @return a failure
   */
  static <T> Failure<T> failure(FailureReason reason, String message) {
    return new Failure<>(reason, message);
  }

  /** Returns {@code true} for a {@link Success}. */
  boolean isSuccess();

  /** Returns the value of a success, empty for failures and {@code null} values. */
  Optional<T> value();

  /** Returns the failure reason, empty for successes. */
  Optional<FailureReason> failureReason();

  /**
   * Returns the value of a success.
   *
   * @throws FederationOperationException if this is a failure
   */
  T orElseThrow();

  /**
   * Re-types a failure so it can be returned from an operation with a different value type.
   *
   * @throws IllegalStateException if this is a success
   */
  <U> Failure<U> asFailure();

  /**
   * Operation completed.
   *
   * @param result the carried value, may be {@code null}
   */
  record Success<T>(T result) implements OperationResult<T> {
    @Override
    public boolean isSuccess() {
      return true;
    }

    @Override
    public Optional<T> value() {
      return Optional.ofNullable(result);
    }

    @Override
    public Optional<FailureReason> failureReason() {
      return Optional.empty();
    }

    @Override
    public T orElseThrow() {
      return result;
    }

    @Override
    public <U> Failure<U> asFailure() {
      throw new IllegalStateException("result is a success");
    }
  }

  /**
   * Operation did not complete.
   *
   * @param reason  why it failed (never {@code null})
   * @param message human-readable detail
   */
  record Failure<T>(FailureReason reason, String message) implements OperationResult<T> {
    public Failure {
      Objects.requireNonNull(reason, "reason");
    }

    @Override
    public boolean isSuccess() {
      return false;
    }

    @Override
    public Optional<T> value() {
      return Optional.empty();
    }

    @Override
    public Optional<FailureReason> failureReason() {
      return Optional.of(reason);
    }

    @Override
    public T orElseThrow() {
      throw new FederationOperationException(reason, message);
    }

    @Override
    public <U> Failure<U> asFailure() {
      return new Failure<>(reason, message);
    }
  }
}
