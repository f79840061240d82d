package calendar.spring.boot;

import calendar.CalendarFederation;
import calendar.dispatch.CalendarDispatcher;
import calendar.dispatch.MergeEngine;
import calendar.jdbc.ConnectionProvider;
import calendar.jdbc.DataSourceConnectionProvider;
import calendar.jdbc.Database;
import calendar.jdbc.JdbcHiddenItemStore;
import calendar.jdbc.JdbcUidIndex;
import calendar.local.InMemoryHiddenItemStore;
import calendar.local.InMemoryUidIndex;
import calendar.registry.BackendDescriptor;
import calendar.registry.BackendFactory;
import calendar.registry.BackendRegistry;
import calendar.registry.DefaultBackendRegistry;
import calendar.registry.SetupReport;
import calendar.spi.CalendarCache;
import calendar.spi.HiddenItemStore;
import calendar.spi.LogSink;
import calendar.spi.MetricsExporter;
import calendar.spi.UidIndex;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Auto-configuration for the calendar federation layer.
 *
 * <p>Builds a {@link CalendarFederation} from {@link CalendarProperties}. Every
 * {@link BackendFactory} bean is registered under its bean name; descriptors from
 * {@code calendar.backends} are set up at startup, and the default backend is activated
 * when none of them could be. With a {@link DataSource} the hidden items and the UID index
 * are stored in JDBC tables and the default backend is {@link Database}; without one they
 * are kept in memory and the default backend is {@link calendar.local.Local}.
 *
 * @see CalendarProperties
 * @see CalendarMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(CalendarFederation.class)
@EnableConfigurationProperties(CalendarProperties.class)
public class CalendarAutoConfiguration {
  private static final Logger logger = Logger.getLogger(CalendarAutoConfiguration.class.getName());

  static final String DATABASE_TYPE = "database";

  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(Database.class)
  @ConditionalOnBean(DataSource.class)
  static class JdbcConfiguration {

    @Bean
    @ConditionalOnMissingBean(ConnectionProvider.class)
    public DataSourceConnectionProvider calendarConnectionProvider(DataSource dataSource) {
      return new DataSourceConnectionProvider(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean(HiddenItemStore.class)
    public JdbcHiddenItemStore hiddenItemStore(ConnectionProvider connectionProvider, CalendarProperties props) {
      return new JdbcHiddenItemStore(connectionProvider, props.getJdbc().getTablePrefix());
    }

    @Bean
    @ConditionalOnMissingBean(UidIndex.class)
    public JdbcUidIndex uidIndex(ConnectionProvider connectionProvider, CalendarProperties props) {
      return new JdbcUidIndex(connectionProvider, props.getJdbc().getTablePrefix());
    }

    /**
     * Factory for {@code database} descriptors. The connection provider is bound here; the
     * only descriptor argument is an optional table prefix.
     */
    @Bean(name = DATABASE_TYPE)
    @ConditionalOnMissingBean(name = DATABASE_TYPE)
    public BackendFactory databaseBackendFactory(ConnectionProvider connectionProvider, CalendarProperties props) {
      return arguments -> {
        List<Object> bound = new ArrayList<>();
        bound.add(connectionProvider);
        bound.add(arguments.isEmpty() ? props.getJdbc().getTablePrefix() : arguments.get(0));
        return Database.FACTORY.create(bound);
      };
    }
  }

  @Bean
  @ConditionalOnMissingBean
  public LogSink calendarLogSink() {
    return LogSink.JUL;
  }

  @Bean
  @ConditionalOnMissingBean
  public CalendarCache calendarCache() {
    return CalendarCache.NONE;
  }

  @Bean
  @ConditionalOnMissingBean(HiddenItemStore.class)
  public InMemoryHiddenItemStore inMemoryHiddenItemStore() {
    return new InMemoryHiddenItemStore();
  }

  @Bean
  @ConditionalOnMissingBean(UidIndex.class)
  public InMemoryUidIndex inMemoryUidIndex() {
    return new InMemoryUidIndex();
  }

  @Bean
  @ConditionalOnMissingBean(BackendRegistry.class)
  public DefaultBackendRegistry backendRegistry(CalendarProperties props,
      ListableBeanFactory beanFactory,
      ObjectProvider<MetricsExporter> metricsProvider) {
    Map<String, BackendFactory> factories = beanFactory.getBeansOfType(BackendFactory.class);
    DefaultBackendRegistry.Builder builder = DefaultBackendRegistry.builder()
        .metrics(metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP));
    factories.forEach(builder::factory);
    BackendFactory database = factories.get(DATABASE_TYPE);
    if (database != null) {
      builder.defaultBackend(() -> database.create(List.of()));
    }
    DefaultBackendRegistry registry = builder.build();

    for (CalendarProperties.Backend backend : props.getBackends()) {
      List<Object> arguments = new ArrayList<>(backend.getArguments());
      registry.register(new BackendDescriptor(backend.getName(), backend.getType(), arguments));
    }
    SetupReport report = registry.setupAll();
    if (report.activated().isEmpty() && props.isActivateDefault()) {
      String name = registry.activate();
      logger.log(Level.INFO, "No calendar backend configured; activated default backend {0}", name);
    }
    logger.log(Level.INFO, "Activated calendar backends: {0}", registry.listActivatedNames());
    return registry;
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public CalendarFederation calendarFederation(BackendRegistry registry,
      CalendarCache cache,
      HiddenItemStore hiddenItems,
      UidIndex uidIndex,
      LogSink logSink,
      ObjectProvider<MetricsExporter> metricsProvider) {
    CalendarFederation.Builder builder = CalendarFederation.builder()
        .registry(registry)
        .cache(cache)
        .hiddenItems(hiddenItems)
        .uidIndex(uidIndex)
        .logSink(logSink);
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public CalendarDispatcher calendarDispatcher(CalendarFederation federation) {
    return federation.dispatcher();
  }

  @Bean
  @ConditionalOnMissingBean
  public MergeEngine mergeEngine(CalendarFederation federation) {
    return federation.mergeEngine();
  }
}
