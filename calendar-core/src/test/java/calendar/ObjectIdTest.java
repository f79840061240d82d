package calendar;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ObjectIdTest {

  @Test
  void encodesAndDecodesThreeSegments() {
    String encoded = ObjectId.encode("database", "personal", "abc");

    assertEquals("database.personal.abc", encoded);
    ObjectId decoded = ObjectId.decode(encoded);
    assertEquals("database", decoded.backend());
    assertEquals("personal", decoded.calendar());
    assertEquals(Optional.of("abc"), decoded.object());
    assertTrue(decoded.isObject());
    assertEquals("database.personal", decoded.calendarId());
  }

  @Test
  void decodesCalendarIdentifier() {
    ObjectId decoded = ObjectId.decode("local.work");

    assertEquals("local", decoded.backend());
    assertEquals("work", decoded.calendar());
    assertFalse(decoded.isObject());
    assertEquals(Optional.empty(), decoded.object());
    assertEquals("local.work", decoded.toString());
  }

  @Test
  void segmentsAreCaseSensitive() {
    ObjectId decoded = ObjectId.decode("Database.Personal.ABC");

    assertEquals("Database", decoded.backend());
    assertNotEquals(ObjectId.decode("database.personal.abc"), decoded);
  }

  @Test
  void decodeRejectsWrongSegmentCount() {
    assertThrows(MalformedIdentifierException.class, () -> ObjectId.decode("database"));
    assertThrows(MalformedIdentifierException.class, () -> ObjectId.decode("a.b.c.d"));
    assertThrows(MalformedIdentifierException.class, () -> ObjectId.decode(""));
  }

  @Test
  void decodeRejectsEmptySegments() {
    assertThrows(MalformedIdentifierException.class, () -> ObjectId.decode("a..c"));
    assertThrows(MalformedIdentifierException.class, () -> ObjectId.decode(".b"));
    assertThrows(MalformedIdentifierException.class, () -> ObjectId.decode("a.b."));
    assertThrows(MalformedIdentifierException.class, () -> ObjectId.decode("."));
  }

  @Test
  void decodeRejectsNull() {
    MalformedIdentifierException e =
        assertThrows(MalformedIdentifierException.class, () -> ObjectId.decode(null));
    assertNull(e.identifier());
  }

  @Test
  void malformedIdentifierKeepsInput() {
    MalformedIdentifierException e =
        assertThrows(MalformedIdentifierException.class, () -> ObjectId.decode("a.b.c.d"));
    assertEquals("a.b.c.d", e.identifier());
  }

  @Test
  void encodeRejectsEmptySegment() {
    InvalidSegmentException e =
        assertThrows(InvalidSegmentException.class, () -> ObjectId.encode("database", "", "abc"));
    assertEquals("calendar", e.segmentName());
  }

  @Test
  void encodeRejectsDelimiterInsideSegment() {
    InvalidSegmentException e =
        assertThrows(InvalidSegmentException.class, () -> ObjectId.encode("database", "personal", "a.b"));
    assertEquals("object", e.segmentName());
    assertEquals("a.b", e.value());
  }

  @Test
  void encodeWithoutUidYieldsCalendarForm() {
    assertEquals("local.work", ObjectId.encode("local", "work", null));
    assertEquals("local.work", ObjectId.encode("local", "work"));
  }

  @Test
  void decodeObjectRequiresObjectSegment() {
    assertThrows(MalformedIdentifierException.class, () -> ObjectId.decodeObject("local.work"));
    assertEquals("x", ObjectId.decodeObject("local.work.x").uid());
  }

  @Test
  void decodeCalendarRejectsObjectSegment() {
    assertThrows(MalformedIdentifierException.class, () -> ObjectId.decodeCalendar("local.work.x"));
    assertEquals("work", ObjectId.decodeCalendar("local.work").calendar());
  }

  @Test
  void withObjectAddressesObjectInSameCalendar() {
    ObjectId calendar = ObjectId.of("local", "work");

    assertEquals("local.work.evt-1", calendar.withObject("evt-1").toString());
  }
}
