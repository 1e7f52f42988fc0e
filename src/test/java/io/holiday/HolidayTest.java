package io.holiday;

import static io.holiday.catalog.GlobalHolidays.CHRISTMAS;
import static io.holiday.catalog.GlobalHolidays.NEW_YEARS_DAY;
import static io.holiday.catalog.GlobalHolidays.NEW_YEARS_EVE;
import static io.holiday.catalog.UnitedStatesHolidays.HALLOWEEN;
import static io.holiday.catalog.UnitedStatesHolidays.THANKSGIVING;
import static org.junit.jupiter.api.Assertions.*;

import io.holiday.date.MonthName;
import io.holiday.date.NthWeekday;
import io.holiday.date.NthWeekdayOfMonth;
import io.holiday.date.Weekday;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

/** Unit tests for named holidays. */
public class HolidayTest {

  @Test
  void testInYear() {
    assertEquals(LocalDate.of(2020, 12, 25), CHRISTMAS.inYear(2020));
    assertEquals(LocalDate.of(2020, 11, 26), THANKSGIVING.inYear(2020));
    assertEquals(LocalDate.of(2020, 1, 1), NEW_YEARS_DAY.inYear(2020));
    assertEquals(LocalDate.of(2020, 12, 31), NEW_YEARS_EVE.inYear(2020));
  }

  @Test
  void testNewNthHoliday() {
    Holiday pastover = Holiday.nth("Pastover", NthWeekday.FIRST, Weekday.FRIDAY, MonthName.APRIL);
    assertEquals(LocalDate.of(2021, 4, 2), pastover.inYear(2021));
    assertTrue(pastover.matches(LocalDate.of(2021, 4, 2)));
    assertTrue(pastover.matches(LocalDate.of(2022, 4, 1)));
  }

  @Test
  void testNewFixedHoliday() {
    Holiday holiday = Holiday.fixed("April 2nd", MonthName.APRIL, 2);
    assertEquals(LocalDate.of(2021, 4, 2), holiday.inYear(2021));
    assertTrue(holiday.matches(LocalDate.of(2021, 4, 2)));
    assertTrue(holiday.matches(LocalDate.of(2022, 4, 2)));
  }

  @Test
  void testMatchesConcreteDates() {
    assertEquals(NthWeekdayOfMonth.of(4, Weekday.THURSDAY, 11), THANKSGIVING.pattern());
    assertTrue(THANKSGIVING.matches(LocalDate.of(2020, 11, 26)));
    assertTrue(THANKSGIVING.matches(LocalDate.of(2021, 11, 25)));
    assertFalse(THANKSGIVING.matches(LocalDate.of(2021, 11, 26)));

    assertTrue(HALLOWEEN.matches(LocalDate.of(2020, 10, 31)));
    assertTrue(HALLOWEEN.matches(LocalDate.of(2021, 10, 31)));
    assertFalse(HALLOWEEN.matches(LocalDate.of(2020, 10, 30)));
  }

  @Test
  void testLastAndFourthMatchSameDate() {
    Holiday last =
        Holiday.nth("Last Tuesday in July", NthWeekday.LAST, Weekday.TUESDAY, MonthName.JULY);
    Holiday fourth =
        Holiday.nth("Fourth Tuesday in July", NthWeekday.FOURTH, Weekday.TUESDAY, MonthName.JULY);
    LocalDate date = LocalDate.of(2020, 7, 28);

    assertTrue(last.matches(date));
    assertTrue(fourth.matches(date));
    assertNotEquals(last, fourth);
  }

  @Test
  void testSortsByMonth() {
    List<Holiday> holidays =
        new ArrayList<>(List.of(NEW_YEARS_EVE, THANKSGIVING, NEW_YEARS_DAY, HALLOWEEN, CHRISTMAS));
    Collections.sort(holidays);

    assertEquals(
        List.of(NEW_YEARS_DAY, HALLOWEEN, THANKSGIVING, CHRISTMAS, NEW_YEARS_EVE), holidays);
  }

  @Test
  void testSamePatternSortsByName() {
    Holiday b = Holiday.fixed("Boxing Day", MonthName.DECEMBER, 26);
    Holiday a = Holiday.fixed("A Day After Christmas", MonthName.DECEMBER, 26);

    assertTrue(a.compareTo(b) < 0);
    assertTrue(b.compareTo(a) > 0);
    assertEquals(0, b.compareTo(Holiday.fixed("Boxing Day", MonthName.DECEMBER, 26)));
  }

  @Test
  void testEqualityNeedsNameAndPattern() {
    assertEquals(Holiday.fixed("Halloween", MonthName.OCTOBER, 31), HALLOWEEN);
    assertNotEquals(Holiday.fixed("Samhain", MonthName.OCTOBER, 31), HALLOWEEN);
  }

  @Test
  void testParseCatalogName() throws HolidayException {
    assertSame(THANKSGIVING, Holiday.parse("Thanksgiving"));
    assertSame(CHRISTMAS, Holiday.parse("christmas day"));
  }

  @Test
  void testParsePatternExpression() throws HolidayException {
    Holiday h = Holiday.parse("fourth thursday in november");
    assertEquals("fourth thursday in november", h.name());
    assertEquals(THANKSGIVING.pattern(), h.pattern());
  }

  @Test
  void testParseUnknown() {
    HolidayException e = assertThrows(HolidayException.class, () -> Holiday.parse("festivus"));
    assertEquals(ErrorKind.LEX, e.kind());
  }

  @Test
  void testOccurrences() {
    List<LocalDate> dates =
        THANKSGIVING.occurrences(LocalDate.of(2020, 11, 26)).limit(3).collect(Collectors.toList());
    assertEquals(
        List.of(LocalDate.of(2020, 11, 26), LocalDate.of(2021, 11, 25), LocalDate.of(2022, 11, 24)),
        dates);
  }

  @Test
  void testBetweenExcludesEnd() {
    List<LocalDate> dates =
        HALLOWEEN
            .between(LocalDate.of(2020, 10, 31), LocalDate.of(2023, 10, 31))
            .collect(Collectors.toList());
    assertEquals(
        List.of(LocalDate.of(2020, 10, 31), LocalDate.of(2021, 10, 31), LocalDate.of(2022, 10, 31)),
        dates);
  }

  @Test
  void testToStringIsName() {
    assertEquals("Thanksgiving", THANKSGIVING.toString());
    assertEquals("fourth thursday of nov", THANKSGIVING.pattern().toString());
  }
}
