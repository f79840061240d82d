package calendar.local;

import calendar.Calendar;
import calendar.CalendarObject;
import calendar.spi.BackendAction;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LocalTest {
  private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

  private static Calendar calendar(String uri, String owner) {
    return Calendar.builder(uri).owner(owner).build();
  }

  @Test
  void listsCalendarsOfOwnerInInsertionOrder() {
    Local local = new Local();
    local.createCalendar(calendar("work", "alice"));
    local.createCalendar(calendar("shared", "bob"));
    local.createCalendar(calendar("personal", "alice"));

    List<Calendar> calendars = local.getCalendars("alice");

    assertEquals(List.of("work", "personal"), calendars.stream().map(Calendar::uri).toList());
  }

  @Test
  void onlyOwnerMayWrite() {
    Local local = new Local().load(calendar("work", "alice"));

    assertTrue(local.isCalendarWritableByUser("work", "alice"));
    assertFalse(local.isCalendarWritableByUser("work", "bob"));
    assertFalse(local.isCalendarWritableByUser("missing", "alice"));
  }

  @Test
  void rejectsDuplicateCalendar() {
    Local local = new Local().load(calendar("work", "alice"));

    assertThrows(IllegalStateException.class, () -> local.createCalendar(calendar("work", "alice")));
  }

  @Test
  void editingMissingItemsThrows() {
    Local local = new Local().load(calendar("work", "alice"), CalendarObject.builder("a").build());

    assertThrows(IllegalArgumentException.class, () -> local.editCalendar(calendar("missing", "alice")));
    assertThrows(IllegalArgumentException.class,
        () -> local.editObject("work", CalendarObject.builder("b").build()));
    assertThrows(IllegalArgumentException.class,
        () -> local.editObject("missing", CalendarObject.builder("a").build()));
    assertEquals(1, local.getObjects("work").size());
    assertTrue(local.findCalendar("missing").isEmpty());
  }

  @Test
  void deletingCalendarDropsItsObjects() {
    Local local = new Local().load(calendar("work", "alice"), CalendarObject.builder("a").build());

    assertTrue(local.deleteCalendar("work"));

    assertTrue(local.getObjects("work").isEmpty());
    assertFalse(local.deleteCalendar("work"));
  }

  @Test
  void operationsOutsideCapabilitySetThrow() {
    Local local = new Local(EnumSet.of(BackendAction.CREATE_OBJECT)).load(calendar("work", "alice"));

    assertFalse(local.supports(BackendAction.DELETE_OBJECT));
    assertThrows(UnsupportedOperationException.class, () -> local.deleteObject("work", "a"));
    assertThrows(UnsupportedOperationException.class, () -> local.createCalendar(calendar("x", "alice")));
    assertDoesNotThrow(() -> local.createObject("work", CalendarObject.builder("a").build()));
  }

  @Test
  void createObjectRequiresExistingCalendar() {
    Local local = new Local();

    assertThrows(IllegalArgumentException.class, () ->
        local.createObject("missing", CalendarObject.builder("a").build()));
  }

  @Test
  void getInPeriodFiltersByIntersection() {
    Local local = new Local().load(calendar("work", "alice"),
        CalendarObject.builder("in").start(Instant.parse("2024-03-01T09:00:00Z")).build(),
        CalendarObject.builder("out").start(Instant.parse("2024-04-01T09:00:00Z")).build());

    List<CalendarObject> objects = local.getInPeriod("work",
        Instant.parse("2024-03-01T00:00:00Z"), Instant.parse("2024-03-02T00:00:00Z"));

    assertEquals(List.of("in"), objects.stream().map(CalendarObject::uid).toList());
  }

  @Test
  void touchStampsLastModified() {
    Local local = new Local(EnumSet.allOf(BackendAction.class), Clock.fixed(NOW, ZoneOffset.UTC))
        .load(calendar("work", "alice"), CalendarObject.builder("a").build());

    assertTrue(local.touchCalendar("work"));
    assertTrue(local.touchObject("work", "a"));
    assertFalse(local.touchObject("work", "b"));

    assertEquals(Optional.of(NOW.toString()), local.findCalendar("work").orElseThrow().property(Local.LAST_MODIFIED));
    assertEquals(Optional.of(NOW.toString()), local.findObject("work", "a").orElseThrow().property(Local.LAST_MODIFIED));
  }

  @Test
  void mergeMovesObjectsAndRemovesSource() {
    Local local = new Local()
        .load(calendar("personal", "alice"), CalendarObject.builder("p").build())
        .load(calendar("work", "alice"), CalendarObject.builder("w1").build(), CalendarObject.builder("w2").build());

    assertEquals(2, local.mergeCalendar("personal", "work"));

    assertEquals(List.of("p", "w1", "w2"), local.getObjects("personal").stream().map(CalendarObject::uid).toList());
    assertTrue(local.findCalendar("work").isEmpty());
  }

  @Test
  void mergeRefusesUidCollisionWithoutMovingAnything() {
    Local local = new Local()
        .load(calendar("personal", "alice"), CalendarObject.builder("w2").build())
        .load(calendar("work", "alice"), CalendarObject.builder("w1").build(), CalendarObject.builder("w2").build());

    assertThrows(IllegalStateException.class, () -> local.mergeCalendar("personal", "work"));

    assertEquals(2, local.getObjects("work").size());
  }

  @Test
  void moveObjectBetweenCalendars() {
    Local local = new Local()
        .load(calendar("personal", "alice"), CalendarObject.builder("a").build())
        .load(calendar("work", "alice"));

    assertTrue(local.moveObject("personal", "a", "work"));

    assertTrue(local.findObject("personal", "a").isEmpty());
    assertTrue(local.findObject("work", "a").isPresent());
    assertFalse(local.moveObject("personal", "a", "work"));
  }

  @Test
  void inMemoryStoresRoundTrip() {
    InMemoryHiddenItemStore hidden = new InMemoryHiddenItemStore();
    hidden.hideCalendar("local.work");
    hidden.hideObject("local.personal.a");

    assertTrue(hidden.isCalendarHidden("local.work"));
    assertFalse(hidden.isCalendarHidden("local.personal"));
    assertTrue(hidden.isObjectHidden("local.personal.a"));

    InMemoryUidIndex index = new InMemoryUidIndex();
    index.put("a", "local.personal.a");
    index.remove("a", "local.work.a");
    assertEquals(Optional.of("local.personal.a"), index.lookup("a"));
    index.remove("a", "local.personal.a");
    assertEquals(Optional.empty(), index.lookup("a"));
  }
}
