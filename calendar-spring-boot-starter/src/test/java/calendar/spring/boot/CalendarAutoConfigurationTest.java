package calendar.spring.boot;

import calendar.Calendar;
import calendar.CalendarFederation;
import calendar.CalendarObject;
import calendar.dispatch.CalendarDispatcher;
import calendar.dispatch.MergeEngine;
import calendar.jdbc.ConnectionProvider;
import calendar.jdbc.Database;
import calendar.jdbc.DataSourceConnectionProvider;
import calendar.jdbc.JdbcHiddenItemStore;
import calendar.jdbc.JdbcUidIndex;
import calendar.local.InMemoryHiddenItemStore;
import calendar.local.InMemoryUidIndex;
import calendar.local.Local;
import calendar.registry.BackendFactory;
import calendar.registry.BackendRegistry;
import calendar.spi.BackendAction;
import calendar.spi.HiddenItemStore;
import calendar.spi.LogSink;
import calendar.spi.UidIndex;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CalendarAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          SqlInitializationAutoConfiguration.class,
          CalendarAutoConfiguration.class))
      .withPropertyValues(
          "spring.datasource.generate-unique-name=true",
          "spring.sql.init.schema-locations=classpath:schema/h2.sql");

  private final ApplicationContextRunner withoutDataSource = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(CalendarAutoConfiguration.class));

  @Test
  void createsAllBeans() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("calendarConnectionProvider"));
      assertTrue(ctx.containsBean("hiddenItemStore"));
      assertTrue(ctx.containsBean("uidIndex"));
      assertTrue(ctx.containsBean("database"));
      assertTrue(ctx.containsBean("backendRegistry"));
      assertTrue(ctx.containsBean("calendarFederation"));
      assertTrue(ctx.containsBean("calendarDispatcher"));
      assertTrue(ctx.containsBean("mergeEngine"));

      assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
      assertInstanceOf(JdbcHiddenItemStore.class, ctx.getBean(HiddenItemStore.class));
      assertInstanceOf(JdbcUidIndex.class, ctx.getBean(UidIndex.class));
      assertSame(LogSink.JUL, ctx.getBean(LogSink.class));
      assertSame(ctx.getBean(CalendarFederation.class).dispatcher(), ctx.getBean(CalendarDispatcher.class));
      assertSame(ctx.getBean(CalendarFederation.class).mergeEngine(), ctx.getBean(MergeEngine.class));
    });
  }

  @Test
  void activatesDatabaseByDefaultWithDataSource() {
    runner.run(ctx -> {
      BackendRegistry registry = ctx.getBean(BackendRegistry.class);
      assertEquals(List.of("database"), registry.listActivatedNames());
      assertInstanceOf(Database.class, registry.find("database").orElseThrow());
    });
  }

  @Test
  void databaseBackendPersistsThroughDispatcher() {
    runner.run(ctx -> {
      CalendarDispatcher dispatcher = ctx.getBean(CalendarDispatcher.class);
      dispatcher.createCalendar("database", Calendar.builder("personal").owner("alice").build()).orElseThrow();
      CalendarObject created = dispatcher.createObject("database.personal",
          CalendarObject.builder("abc").start(Instant.parse("2024-03-01T09:00:00Z")).build()).orElseThrow();

      assertEquals("database.personal.abc", created.objectId().orElseThrow());
      assertEquals("database.personal.abc",
          ctx.getBean(UidIndex.class).lookup("abc").orElseThrow());
      assertEquals(1, dispatcher.listObjects("database.personal").orElseThrow().size());
    });
  }

  @Test
  void fallsBackToInMemoryWithoutDataSource() {
    withoutDataSource.run(ctx -> {
      assertFalse(ctx.containsBean("database"));
      assertInstanceOf(InMemoryHiddenItemStore.class, ctx.getBean(HiddenItemStore.class));
      assertInstanceOf(InMemoryUidIndex.class, ctx.getBean(UidIndex.class));

      BackendRegistry registry = ctx.getBean(BackendRegistry.class);
      assertEquals(List.of("local"), registry.listActivatedNames());
    });
  }

  @Test
  void configuredDescriptorsReplaceDefault() {
    withoutDataSource
        .withPropertyValues(
            "calendar.backends[0].name=shared",
            "calendar.backends[0].type=local",
            "calendar.backends[0].arguments=CREATE_CALENDAR,CREATE_OBJECT")
        .run(ctx -> {
          BackendRegistry registry = ctx.getBean(BackendRegistry.class);
          assertEquals(List.of("local"), registry.listActivatedNames());
          assertEquals(Set.of(BackendAction.CREATE_CALENDAR, BackendAction.CREATE_OBJECT),
              registry.find("local").orElseThrow().supportedActions());
        });
  }

  @Test
  void unknownTypeIsSkippedAndDefaultActivated() {
    withoutDataSource
        .withPropertyValues(
            "calendar.backends[0].name=remote",
            "calendar.backends[0].type=caldav")
        .run(ctx -> {
          assertNull(ctx.getStartupFailure());
          BackendRegistry registry = ctx.getBean(BackendRegistry.class);
          assertEquals(List.of("local"), registry.listActivatedNames());
          assertEquals(1, registry.listDescriptors().size());
        });
  }

  @Test
  void defaultActivationCanBeDisabled() {
    withoutDataSource
        .withPropertyValues("calendar.activate-default=false")
        .run(ctx -> assertTrue(ctx.getBean(BackendRegistry.class).listActivatedNames().isEmpty()));
  }

  @Test
  void factoryBeansAreRegisteredUnderTheirBeanName() {
    withoutDataSource
        .withUserConfiguration(MemoFactoryConfig.class)
        .withPropertyValues(
            "calendar.backends[0].name=notes",
            "calendar.backends[0].type=memo")
        .run(ctx -> {
          BackendRegistry registry = ctx.getBean(BackendRegistry.class);
          assertEquals(List.of("memo"), registry.listActivatedNames());
        });
  }

  @Test
  void databaseDescriptorUsesConfiguredPrefix() {
    runner
        .withPropertyValues(
            "calendar.jdbc.table-prefix=cal_",
            "spring.sql.init.schema-locations=classpath:schema/h2-prefixed.sql",
            "calendar.backends[0].name=primary",
            "calendar.backends[0].type=database")
        .run(ctx -> {
          CalendarDispatcher dispatcher = ctx.getBean(CalendarDispatcher.class);
          dispatcher.createCalendar("database", Calendar.builder("personal").owner("alice").build()).orElseThrow();
          dispatcher.deleteCalendar("database.personal").orElseThrow();

          assertEquals(List.of("database"), ctx.getBean(BackendRegistry.class).listActivatedNames());
          assertTrue(dispatcher.listCalendars("alice").isEmpty());
        });
  }

  @Test
  void respectsConditionalOnMissingBean() {
    runner.withUserConfiguration(CustomStoresConfig.class).run(ctx -> {
      assertInstanceOf(InMemoryHiddenItemStore.class, ctx.getBean(HiddenItemStore.class));
      assertEquals("customHiddenItems", ctx.getBeanNamesForType(HiddenItemStore.class)[0]);
      assertInstanceOf(JdbcUidIndex.class, ctx.getBean(UidIndex.class));
    });
  }

  // ── Test configurations ──────────────────────────────────────

  static class Memo extends Local {
  }

  @Configuration
  static class MemoFactoryConfig {
    @Bean("memo")
    BackendFactory memoFactory() {
      return arguments -> new Memo();
    }
  }

  @Configuration
  static class CustomStoresConfig {
    @Bean
    HiddenItemStore customHiddenItems() {
      return new InMemoryHiddenItemStore();
    }
  }
}
