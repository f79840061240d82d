package calendar.dispatch;

import calendar.registry.DefaultBackendRegistry;
import calendar.spi.BackendAction;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

class CapabilityNegotiatorTest {

  @Test
  void delegatesWhatTheBackendSupports() {
    CapabilityNegotiator negotiator = new CapabilityNegotiator(new DefaultBackendRegistry());
    Database backend = new Database();

    for (BackendAction action : BackendAction.values()) {
      assertEquals(Negotiation.DELEGATE, negotiator.negotiate(backend, action), action.name());
    }
  }

  @Test
  void emulatesDeletesPeriodsMergesAndMoves() {
    CapabilityNegotiator negotiator = new CapabilityNegotiator(new DefaultBackendRegistry());
    Database backend = new Database(EnumSet.noneOf(BackendAction.class));

    assertEquals(Negotiation.EMULATE, negotiator.negotiate(backend, BackendAction.DELETE_CALENDAR));
    assertEquals(Negotiation.EMULATE, negotiator.negotiate(backend, BackendAction.DELETE_OBJECT));
    assertEquals(Negotiation.EMULATE, negotiator.negotiate(backend, BackendAction.GET_IN_PERIOD));
    assertEquals(Negotiation.EMULATE, negotiator.negotiate(backend, BackendAction.MERGE_CALENDAR));
    assertEquals(Negotiation.EMULATE, negotiator.negotiate(backend, BackendAction.MOVE_OBJECT));
  }

  @Test
  void everythingElseIsUnsupportedWithoutNativeSupport() {
    CapabilityNegotiator negotiator = new CapabilityNegotiator(new DefaultBackendRegistry());
    Database backend = new Database(EnumSet.noneOf(BackendAction.class));

    for (BackendAction action : EnumSet.of(BackendAction.CREATE_CALENDAR, BackendAction.EDIT_CALENDAR,
        BackendAction.TOUCH_CALENDAR, BackendAction.CREATE_OBJECT, BackendAction.EDIT_OBJECT,
        BackendAction.TOUCH_OBJECT)) {
      assertEquals(Negotiation.UNSUPPORTED, negotiator.negotiate(backend, action), action.name());
      assertFalse(CapabilityNegotiator.isEmulable(action));
    }
  }

  @Test
  void supportsByNameLooksUpActivatedBackend() {
    DefaultBackendRegistry registry = new DefaultBackendRegistry();
    registry.activate(new Database(EnumSet.of(BackendAction.GET_IN_PERIOD)));
    CapabilityNegotiator negotiator = new CapabilityNegotiator(registry);

    assertTrue(negotiator.supports("database", BackendAction.GET_IN_PERIOD));
    assertFalse(negotiator.supports("database", BackendAction.MERGE_CALENDAR));
    assertFalse(negotiator.supports("caldav", BackendAction.GET_IN_PERIOD));
  }
}
