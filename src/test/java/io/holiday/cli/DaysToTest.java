package io.holiday.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DaysToTest {
  // a Sunday
  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2026-10-18T12:00:00Z"), ZoneOffset.UTC);

  private ByteArrayOutputStream out;
  private ByteArrayOutputStream err;

  @BeforeEach
  void setUp() {
    out = new ByteArrayOutputStream();
    err = new ByteArrayOutputStream();
  }

  private int run(String... args) {
    return DaysTo.run(
        args,
        CLOCK,
        new PrintStream(out, true, StandardCharsets.UTF_8),
        new PrintStream(err, true, StandardCharsets.UTF_8));
  }

  private List<String> outLines() {
    return List.of(out.toString(StandardCharsets.UTF_8).split("\\R"));
  }

  @Test
  void namesPatternsAndDates() {
    assertEquals(0, run("thanksgiving", "last friday of june", "2027-01-01"));
    assertEquals(
        List.of(
            "Days until Thanksgiving: 39",
            "Days until last friday of june: 250",
            "Days until 2027-01-01: 75"),
        outLines());
    assertEquals("", err.toString(StandardCharsets.UTF_8));
  }

  @Test
  void catalogNameIsPrintedCanonically() {
    assertEquals(0, run("xmas", "the fourth of july"));
    assertEquals(
        List.of("Days until Christmas: 68", "Days until Independence Day: 259"), outLines());
  }

  @Test
  void occurrenceTodayIsZeroDays() {
    assertEquals(0, run("--today", "2026-11-26", "thanksgiving"));
    assertEquals(List.of("Days until Thanksgiving: 0"), outLines());
  }

  @Test
  void relativeDates() {
    assertEquals(0, run("tomorrow", "in 2 weeks", "next friday"));
    assertEquals(
        List.of(
            "Days until tomorrow: 1", "Days until in 2 weeks: 14", "Days until next friday: 5"),
        outLines());
  }

  @Test
  void unknownNameFailsButOthersPrint() {
    assertEquals(1, run("festivus", "halloween"));
    assertEquals(List.of("Days until Halloween: 13"), outLines());
    assertTrue(err.toString(StandardCharsets.UTF_8).contains("Unknown holiday: 'festivus'"));
  }

  @Test
  void dateOutOfRangeIsSkipped() {
    assertEquals(1, run("in 999999999 years", "thanksgiving"));
    assertEquals(List.of("Days until Thanksgiving: 39"), outLines());
    assertTrue(
        err.toString(StandardCharsets.UTF_8).contains("Unknown holiday: 'in 999999999 years'"));
  }

  @Test
  void noOccurrenceBeforeEndOfTimeIsSkipped() {
    assertEquals(1, run("--today", "+999999999-12-20", "thanksgiving", "dec 25"));
    assertEquals(List.of("Days until dec 25: 5"), outLines());
    assertTrue(
        err.toString(StandardCharsets.UTF_8)
            .contains("No date for 'thanksgiving' from +999999999-12-20"));
  }

  @Test
  void unknownNameShowsSuggestion() {
    assertEquals(1, run("6th monday of may"));
    String errText = err.toString(StandardCharsets.UTF_8);
    assertTrue(errText.contains("Unknown holiday: '6th monday of may'"), errText);
    assertTrue(errText.contains("  try: \"last monday\""), errText);
  }

  @Test
  void usageErrors() {
    assertEquals(2, run());
    assertTrue(err.toString(StandardCharsets.UTF_8).contains(DaysTo.USAGE));

    err.reset();
    assertEquals(2, run("--today", "someday", "halloween"));
    assertTrue(err.toString(StandardCharsets.UTF_8).contains("--today expects YYYY-MM-DD"));

    assertEquals(2, run("--today"));
  }
}
