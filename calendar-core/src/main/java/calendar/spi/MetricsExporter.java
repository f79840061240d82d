package calendar.spi;

/**
 * Observability hook for exporting federation counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer or another monitoring system.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of operations handed to a backend's native implementation.
   *
   * @param action the operation kind
   */
  void incrementDelegated(BackendAction action);

  /**
   * Increments the count of operations completed by the federation layer on behalf of a
   * backend lacking the native capability (hide, local period filter, decomposed merge/move).
   *
   * @param action the operation kind
   */
  void incrementEmulated(BackendAction action);

  /**
   * Increments the count of operations rejected as unsupported.
   *
   * @param action the operation kind
   */
  void incrementUnsupported(BackendAction action);

  /**
   * Increments the count of backend calls that threw.
   *
   * @param action the operation kind, {@code null} for read operations
   */
  void incrementBackendFailure(BackendAction action);

  /**
   * Increments the count of identifiers whose backend segment named no activated backend.
   */
  void incrementBackendNotFound();

  /**
   * Records the number of objects moved by one merged source calendar.
   *
   * @param count objects moved (always non-negative)
   */
  default void recordMergedObjects(int count) {
  }

  /**
   * Records the current number of activated backends.
   *
   * @param count activated backends
   */
  default void recordActiveBackends(int count) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementDelegated(BackendAction action) {
    }

    @Override
    public void incrementEmulated(BackendAction action) {
    }

    @Override
    public void incrementUnsupported(BackendAction action) {
    }

    @Override
    public void incrementBackendFailure(BackendAction action) {
    }

    @Override
    public void incrementBackendNotFound() {
    }
  }
}
