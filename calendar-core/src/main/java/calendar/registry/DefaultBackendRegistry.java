package calendar.registry;

import calendar.InvalidBackendException;
import calendar.local.Local;
import calendar.spi.CalendarBackend;
import calendar.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe backend registry with an explicit factory table.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * DefaultBackendRegistry registry = DefaultBackendRegistry.builder()
 *     .factory("local", Local.FACTORY)
 *     .factory("database", Database.FACTORY)
 *     .build();
 *
 * registry.register(BackendDescriptor.of("primary", "database", dataSource));
 * SetupReport report = registry.setupAll();
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>Lookups run against concurrent collections and never observe a partially inserted
 * backend. Mutations are serialized on the registry but are not coordinated with in-flight
 * federation operations.
 *
 * @see BackendRegistry
 */
public final class DefaultBackendRegistry implements BackendRegistry {
  private static final Logger logger = Logger.getLogger(DefaultBackendRegistry.class.getName());

  private final Supplier<? extends CalendarBackend> defaultBackend;
  private final Map<String, BackendFactory> factories;
  private final MetricsExporter metrics;

  private final List<BackendDescriptor> descriptors = new CopyOnWriteArrayList<>();
  private final Map<String, CalendarBackend> activated = new ConcurrentHashMap<>();
  private final List<String> activationOrder = new CopyOnWriteArrayList<>();
  private final Set<Integer> setUpDescriptors = new HashSet<>();

  private DefaultBackendRegistry(Builder builder) {
    this.defaultBackend = builder.defaultBackend;
    this.factories = Collections.unmodifiableMap(new LinkedHashMap<>(builder.factories));
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  /**
   * Creates a registry with the in-memory {@link Local} backend as default and a
   * {@code local} factory.
   */
  public DefaultBackendRegistry() {
    this(builder());
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public DefaultBackendRegistry register(BackendDescriptor descriptor) {
    descriptors.add(Objects.requireNonNull(descriptor, "descriptor"));
    return this;
  }

  @Override
  public String activate() {
    return activate(defaultBackend.get());
  }

  @Override
  public synchronized String activate(Object backend) {
    if (!(backend instanceof CalendarBackend calendarBackend)) {
      throw new InvalidBackendException("Not a calendar backend: "
          + (backend == null ? "null" : backend.getClass().getName()));
    }
    String name = BackendRegistry.canonicalName(calendarBackend);
    if (name.isEmpty()) {
      throw new InvalidBackendException("Backend class " + backend.getClass().getName()
          + " has no simple name to derive a canonical name from");
    }
    if (activated.put(name, calendarBackend) == null) {
      activationOrder.add(name);
    } else {
      logger.log(Level.FINE, "Replaced activated backend {0}", name);
    }
    metrics.recordActiveBackends(activated.size());
    return name;
  }

  @Override
  public synchronized SetupReport setupAll() {
    List<SetupReport.Activated> done = new ArrayList<>();
    List<SetupReport.Skipped> skipped = new ArrayList<>();
    for (int i = 0; i < descriptors.size(); i++) {
      if (setUpDescriptors.contains(i)) {
        continue;
      }
      BackendDescriptor descriptor = descriptors.get(i);
      BackendFactory factory = factories.get(descriptor.type());
      if (factory == null) {
        skip(skipped, descriptor, "no factory registered for type '" + descriptor.type() + "'", null);
        continue;
      }
      CalendarBackend backend;
      try {
        backend = factory.create(descriptor.arguments());
      } catch (RuntimeException e) {
        skip(skipped, descriptor, "factory failed: " + e.getMessage(), e);
        continue;
      }
      if (backend == null) {
        skip(skipped, descriptor, "factory returned null", null);
        continue;
      }
      String name;
      try {
        name = activate(backend);
      } catch (InvalidBackendException e) {
        skip(skipped, descriptor, e.getMessage(), e);
        continue;
      }
      setUpDescriptors.add(i);
      done.add(new SetupReport.Activated(descriptor, name));
    }
    return new SetupReport(done, skipped);
  }

  private static void skip(List<SetupReport.Skipped> skipped, BackendDescriptor descriptor,
      String reason, Throwable cause) {
    logger.log(Level.WARNING, "Calendar backend '" + descriptor.name() + "' skipped: " + reason, cause);
    skipped.add(new SetupReport.Skipped(descriptor, reason));
  }

  @Override
  public synchronized void reset() {
    activated.clear();
    activationOrder.clear();
    setUpDescriptors.clear();
    metrics.recordActiveBackends(0);
  }

  @Override
  public List<BackendDescriptor> listDescriptors() {
    return List.copyOf(descriptors);
  }

  @Override
  public List<String> listActivatedNames() {
    List<String> names = new ArrayList<>(activationOrder.size());
    for (String name : activationOrder) {
      if (activated.containsKey(name)) {
        names.add(name);
      }
    }
    return Collections.unmodifiableList(names);
  }

  @Override
  public Optional<CalendarBackend> find(String canonicalName) {
    if (canonicalName == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(activated.get(canonicalName));
  }

  /** Returns the registered factory type keys. */
  public Set<String> factoryTypes() {
    return factories.keySet();
  }

  /**
   * Builder for {@link DefaultBackendRegistry}.
   */
  public static final class Builder {
    private Supplier<? extends CalendarBackend> defaultBackend = Local::new;
    private final Map<String, BackendFactory> factories = new LinkedHashMap<>();
    private MetricsExporter metrics;

    private Builder() {
      factories.put("local", Local.FACTORY);
    }

    /**
     * Sets the supplier used by {@link BackendRegistry#activate()}.
     *
     * <p>Optional. Defaults to a new {@link Local} backend.
     *
     * @param defaultBackend the default backend supplier
     * @return this builder
     */
    public Builder defaultBackend(Supplier<? extends CalendarBackend> defaultBackend) {
      this.defaultBackend = Objects.requireNonNull(defaultBackend, "defaultBackend");
      return this;
    }

    /**
     * Registers a factory under a type key, replacing any factory with the same key.
     *
     * <p>A {@code local} factory is registered by default.
     *
     * @param type    the type key referenced by {@link BackendDescriptor#type()}
     * @param factory the factory
     * @return this builder
     */
    public Builder factory(String type, BackendFactory factory) {
      factories.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(factory, "factory"));
      return this;
    }

    /**
     * Sets the metrics exporter notified of the number of activated backends.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public DefaultBackendRegistry build() {
      return new DefaultBackendRegistry(this);
    }
  }
}
