package calendar;

import calendar.local.Local;
import calendar.registry.BackendDescriptor;
import calendar.registry.DefaultBackendRegistry;
import calendar.spi.BackendAction;
import calendar.spi.MetricsExporter;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class CalendarFederationTest {

  @Test
  void wiresDispatcherAndMergeEngineOverOneRegistry() {
    DefaultBackendRegistry registry = new DefaultBackendRegistry();
    registry.register(BackendDescriptor.of("memory", "local"));
    registry.setupAll();

    try (CalendarFederation federation = CalendarFederation.builder().registry(registry).build()) {
      federation.dispatcher().createCalendar("local", Calendar.builder("personal").owner("alice").build())
          .orElseThrow();
      federation.dispatcher().createCalendar("local", Calendar.builder("work").owner("alice").build())
          .orElseThrow();
      federation.dispatcher().createObject("local.work", CalendarObject.builder("standup").build()).orElseThrow();

      assertTrue(federation.mergeEngine().mergeCalendars("local.personal", "local.work").isSuccess());

      assertSame(registry, federation.registry());
      assertEquals(List.of("personal"),
          federation.dispatcher().listCalendars("alice").stream().map(Calendar::uri).toList());
      assertTrue(federation.dispatcher().findObject("local.personal.standup").isSuccess());
    }
  }

  @Test
  void defaultsToEmptyRegistry() {
    try (CalendarFederation federation = CalendarFederation.builder().build()) {
      assertTrue(federation.registry().listActivatedNames().isEmpty());
      federation.registry().activate();
      assertTrue(federation.registry().find("local").isPresent());
      assertInstanceOf(Local.class, federation.registry().find("local").orElseThrow());
    }
  }

  @Test
  void closeReleasesCloseableMetrics() {
    AtomicBoolean closed = new AtomicBoolean();
    CalendarFederation federation = CalendarFederation.builder().metrics(new ClosingMetrics(closed)).build();

    federation.close();

    assertTrue(closed.get());
  }

  private static final class ClosingMetrics implements MetricsExporter, AutoCloseable {
    private final AtomicBoolean closed;

    ClosingMetrics(AtomicBoolean closed) {
      this.closed = closed;
    }

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

    @Override
    public void close() {
      closed.set(true);
    }
  }
}
