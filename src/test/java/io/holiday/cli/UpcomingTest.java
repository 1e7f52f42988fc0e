package io.holiday.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class UpcomingTest {
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
    return Upcoming.run(
        args,
        CLOCK,
        new PrintStream(out, true, StandardCharsets.UTF_8),
        new PrintStream(err, true, StandardCharsets.UTF_8));
  }

  private List<String> outLines() {
    return List.of(out.toString(StandardCharsets.UTF_8).split("\\R"));
  }

  @Test
  void defaultCount() {
    assertEquals(0, run("thanksgiving"));
    assertEquals(
        List.of(
            "Thanksgiving (fourth thursday of nov)",
            "  2026-11-26  in 39 days",
            "  2027-11-25  in 403 days",
            "  2028-11-23  in 767 days"),
        outLines());
  }

  @Test
  void explicitCount() {
    assertEquals(0, run("--count=1", "last friday of june", "-n", "1"));
    assertEquals(
        List.of("last friday of june (last friday of jun)", "  2027-06-25  in 250 days"),
        outLines());
  }

  @Test
  void includesToday() {
    assertEquals(0, run("--today", "2026-10-31", "--count", "2", "halloween"));
    assertEquals(
        List.of("Halloween (oct 31)", "  2026-10-31  in 0 days", "  2027-10-31  in 365 days"),
        outLines());
  }

  @Test
  void concreteDatePrintsOnce() {
    assertEquals(0, run("tomorrow"));
    assertEquals(List.of("tomorrow", "  2026-10-19  in 1 days"), outLines());
  }

  @Test
  void unknownName() {
    assertEquals(1, run("festivus"));
    assertTrue(err.toString(StandardCharsets.UTF_8).contains("Unknown holiday: 'festivus'"));
  }

  @Test
  void dateOutOfRangeIsSkipped() {
    assertEquals(1, run("-n", "1", "in 999999999 years", "halloween"));
    assertEquals(List.of("Halloween (oct 31)", "  2026-10-31  in 13 days"), outLines());
  }

  @Test
  void stopsAtEndOfTime() {
    assertEquals(0, run("--today", "+999999999-12-20", "christmas"));
    assertEquals(List.of("Christmas (dec 25)", "  +999999999-12-25  in 5 days"), outLines());
  }

  @Test
  void badCount() {
    assertEquals(2, run("-n", "0", "halloween"));
    assertEquals(2, run("--count", "many", "halloween"));
    assertTrue(err.toString(StandardCharsets.UTF_8).contains(Upcoming.USAGE));
  }

  @Test
  void optionsParse() {
    Options options =
        Options.parse(new String[] {"--today=2020-01-01", "-n", "5", "a", "b"}, CLOCK);
    assertEquals(LocalDate.of(2020, 1, 1), options.today());
    assertEquals(5, options.count());
    assertEquals(List.of("a", "b"), options.names());

    Options defaults = Options.parse(new String[] {"x"}, CLOCK);
    assertEquals(LocalDate.of(2026, 10, 18), defaults.today());
    assertEquals(Options.DEFAULT_COUNT, defaults.count());
  }
}
