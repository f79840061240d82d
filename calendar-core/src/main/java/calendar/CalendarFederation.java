package calendar;

import calendar.dispatch.CalendarDispatcher;
import calendar.dispatch.MergeEngine;
import calendar.registry.BackendRegistry;
import calendar.registry.DefaultBackendRegistry;
import calendar.spi.CalendarCache;
import calendar.spi.HiddenItemStore;
import calendar.spi.LogSink;
import calendar.spi.MetricsExporter;
import calendar.spi.UidIndex;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires a {@link BackendRegistry}, a {@link CalendarDispatcher}
 * and a {@link MergeEngine} over the same collaborators.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * DefaultBackendRegistry registry = DefaultBackendRegistry.builder()
 *     .factory("database", Database.FACTORY)
 *     .build();
 * registry.register(BackendDescriptor.of("primary", "database", dataSource));
 * registry.setupAll();
 *
 * try (CalendarFederation federation = CalendarFederation.builder()
 *     .registry(registry)
 *     .build()) {
 *   List<Calendar> calendars = federation.dispatcher().listCalendars("alice");
 *   federation.mergeEngine().mergeCalendars("database.personal", "database.work");
 * }
 * }</pre>
 *
 * <p>Closing releases the metrics exporter when it is {@link AutoCloseable}; backends
 * stay activated.
 */
public final class CalendarFederation implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(CalendarFederation.class.getName());

  private final BackendRegistry registry;
  private final CalendarDispatcher dispatcher;
  private final MergeEngine mergeEngine;
  private final MetricsExporter metrics;

  private CalendarFederation(Builder builder) {
    this.registry = builder.registry != null ? builder.registry : new DefaultBackendRegistry();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.dispatcher = CalendarDispatcher.builder()
        .registry(registry)
        .cache(builder.cache)
        .hiddenItems(builder.hiddenItems)
        .uidIndex(builder.uidIndex)
        .logSink(builder.logSink)
        .metrics(metrics)
        .build();
    this.mergeEngine = new MergeEngine(dispatcher, metrics);
  }

  public static Builder builder() {
    return new Builder();
  }

  public BackendRegistry registry() {
    return registry;
  }

  public CalendarDispatcher dispatcher() {
    return dispatcher;
  }

  public MergeEngine mergeEngine() {
    return mergeEngine;
  }

  @Override
  public void close() {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        logger.log(Level.WARNING, "Failed to close metrics exporter", e);
        throw e instanceof RuntimeException r ? r : new CalendarFederationException("Failed to close metrics exporter", e);
      }
    }
  }

  /**
   * Builder for {@link CalendarFederation}. Every collaborator is optional.
   */
  public static final class Builder {
    private BackendRegistry registry;
    private CalendarCache cache;
    private HiddenItemStore hiddenItems;
    private UidIndex uidIndex;
    private LogSink logSink;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the backend registry.
     *
     * <p>Optional. Defaults to an empty {@link DefaultBackendRegistry}.
     *
     * @param registry the registry
     * @return this builder
     */
    public Builder registry(BackendRegistry registry) {
      this.registry = Objects.requireNonNull(registry, "registry");
      return this;
    }

    /**
     * @param cache the cache gate, defaults to {@link CalendarCache#NONE}
     * @return this builder
     */
    public Builder cache(CalendarCache cache) {
      this.cache = cache;
      return this;
    }

    /**
     * @param hiddenItems the hidden-item store, defaults to an in-memory store
     * @return this builder
     */
    public Builder hiddenItems(HiddenItemStore hiddenItems) {
      this.hiddenItems = hiddenItems;
      return this;
    }

    /**
     * @param uidIndex the UID index, defaults to an in-memory index
     * @return this builder
     */
    public Builder uidIndex(UidIndex uidIndex) {
      this.uidIndex = uidIndex;
      return this;
    }

    /**
     * @param logSink the diagnostics sink, defaults to {@link LogSink#JUL}
     * @return this builder
     */
    public Builder logSink(LogSink logSink) {
      this.logSink = logSink;
      return this;
    }

    /**
     * @param metrics the metrics exporter, defaults to {@link MetricsExporter#NOOP}
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public CalendarFederation build() {
      return new CalendarFederation(this);
    }
  }
}
