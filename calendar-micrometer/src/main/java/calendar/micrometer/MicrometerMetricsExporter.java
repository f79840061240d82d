package calendar.micrometer;

import calendar.spi.BackendAction;
import calendar.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code calendar.operation.delegated} - operations served natively, tagged {@code action}</li>
 *   <li>{@code calendar.operation.emulated} - operations served by hiding, filtering or object transfer</li>
 *   <li>{@code calendar.operation.unsupported} - operations refused as unsupported</li>
 *   <li>{@code calendar.operation.failed} - backend calls that threw; reads are tagged {@code action=read}</li>
 *   <li>{@code calendar.backend.not_found} - lookups naming a backend that is not activated</li>
 *   <li>{@code calendar.merge.objects} - objects moved by calendar merges</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code calendar.backends.active} - number of activated backends</li>
 * </ul>
 *
 * <p>Every meter is registered up front and removed again by {@link #close()}.
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {
  public static final String DEFAULT_PREFIX = "calendar";
  static final String READ_ACTION = "read";

  private final MeterRegistry registry;
  private final Map<BackendAction, Counter> delegated = new EnumMap<>(BackendAction.class);
  private final Map<BackendAction, Counter> emulated = new EnumMap<>(BackendAction.class);
  private final Map<BackendAction, Counter> unsupported = new EnumMap<>(BackendAction.class);
  private final Map<BackendAction, Counter> failed = new EnumMap<>(BackendAction.class);
  private final Counter readFailed;
  private final Counter backendNotFound;
  private final Counter mergedObjects;
  private final List<Meter> meters = new ArrayList<>();

  private final AtomicInteger activeBackends = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the metric name prefix {@value #DEFAULT_PREFIX}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, DEFAULT_PREFIX);
  }

  /**
   * Creates an exporter with a custom metric name prefix, for several federations in one
   * registry.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "tenant.calendar"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    for (BackendAction action : BackendAction.values()) {
      delegated.put(action, counter(namePrefix + ".operation.delegated", tag(action),
          "Operations served natively by a backend"));
      emulated.put(action, counter(namePrefix + ".operation.emulated", tag(action),
          "Operations emulated by the federation layer"));
      unsupported.put(action, counter(namePrefix + ".operation.unsupported", tag(action),
          "Operations refused as unsupported"));
      failed.put(action, counter(namePrefix + ".operation.failed", tag(action),
          "Backend calls that threw"));
    }
    this.readFailed = counter(namePrefix + ".operation.failed", READ_ACTION, "Backend calls that threw");
    this.backendNotFound = register(Counter.builder(namePrefix + ".backend.not_found")
        .description("Lookups naming a backend that is not activated")
        .register(registry));
    this.mergedObjects = register(Counter.builder(namePrefix + ".merge.objects")
        .description("Objects moved by calendar merges")
        .register(registry));
    register(Gauge.builder(namePrefix + ".backends.active", activeBackends, AtomicInteger::get)
        .description("Activated backends")
        .register(registry));
  }

  @Override
  public void incrementDelegated(BackendAction action) {
    if (closed) return;
    delegated.get(action).increment();
  }

  @Override
  public void incrementEmulated(BackendAction action) {
    if (closed) return;
    emulated.get(action).increment();
  }

  @Override
  public void incrementUnsupported(BackendAction action) {
    if (closed) return;
    unsupported.get(action).increment();
  }

  @Override
  public void incrementBackendFailure(BackendAction action) {
    if (closed) return;
    (action == null ? readFailed : failed.get(action)).increment();
  }

  @Override
  public void incrementBackendNotFound() {
    if (closed) return;
    backendNotFound.increment();
  }

  @Override
  public void recordMergedObjects(int count) {
    if (closed || count <= 0) return;
    mergedObjects.increment(count);
  }

  @Override
  public void recordActiveBackends(int count) {
    if (closed) return;
    activeBackends.set(count);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the exporter is no longer needed (e.g. when the
   * {@link calendar.CalendarFederation} is closed) to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }

  private Counter counter(String name, String action, String description) {
    return register(Counter.builder(name)
        .tag("action", action)
        .description(description)
        .register(registry));
  }

  private <M extends Meter> M register(M meter) {
    meters.add(meter);
    return meter;
  }

  private static String tag(BackendAction action) {
    return action.name().toLowerCase(Locale.ROOT);
  }
}
