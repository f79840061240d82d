package calendar.jdbc;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TableNamesTest {

  @Test
  void validTableNameReturnsName() {
    assertEquals("calendar_objects", TableNames.validate("calendar_objects"));
    assertEquals("_objects", TableNames.validate("_objects"));
  }

  @Test
  void defaultPrefixBuildsDefaultTables() {
    assertEquals("calendar_calendars", TableNames.table(TableNames.DEFAULT_PREFIX, TableNames.CALENDARS));
    assertEquals("calendar_uid_index", TableNames.table(TableNames.DEFAULT_PREFIX, TableNames.UID_INDEX));
  }

  @Test
  void emptyPrefixIsAllowed() {
    assertEquals("objects", TableNames.table("", TableNames.OBJECTS));
  }

  @Test
  void nullPrefixThrows() {
    assertThrows(NullPointerException.class, () -> TableNames.validatePrefix(null));
  }

  @Test
  void prefixStartingWithDigitThrows() {
    assertThrows(IllegalArgumentException.class, () -> TableNames.validatePrefix("1cal_"));
  }

  @Test
  void prefixWithSpecialCharsThrows() {
    assertThrows(IllegalArgumentException.class, () -> TableNames.validatePrefix("cal-"));
    assertThrows(IllegalArgumentException.class, () -> TableNames.validatePrefix("cal;drop table x;"));
  }

  @Test
  void emptyTableNameThrows() {
    assertThrows(IllegalArgumentException.class, () -> TableNames.validate(""));
  }
}
